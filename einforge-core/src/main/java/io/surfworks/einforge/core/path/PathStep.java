package io.surfworks.einforge.core.path;

/**
 * One entry of a contraction path: two positions in the operand list as it exists when the
 * step is applied. The order of the pair does not matter.
 *
 * @param first  one position
 * @param second the other position, different from {@code first}
 */
public record PathStep(int first, int second) {

    public PathStep {
        if (first == second) {
            throw new IllegalArgumentException("Path step contracts position " + first + " with itself");
        }
    }

    public int lower() {
        return Math.min(first, second);
    }

    public int higher() {
        return Math.max(first, second);
    }

    @Override
    public String toString() {
        return "[" + first + ", " + second + "]";
    }
}
