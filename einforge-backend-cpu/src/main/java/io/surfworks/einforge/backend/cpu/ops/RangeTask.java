package io.surfworks.einforge.backend.cpu.ops;

/**
 * A slice of kernel work over output elements {@code [start, end)}.
 */
@FunctionalInterface
public interface RangeTask {

    void run(long start, long end);
}
