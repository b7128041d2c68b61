package io.surfworks.einforge.core.einsum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parsed einsum format string {@code "<op1>,<op2>,...-><out>"}; each character is one label.
 *
 * <p>Example: {@code "ba,dca,feb->ki"} has inputs {@code [b,a] [d,c,a] [f,e,b]} and output {@code [k,i]}.
 *
 * @param inputs per-operand label sequences
 * @param output the requested output label sequence
 */
public record EinsumFormat(List<List<Character>> inputs, List<Character> output) {

    private static final String ARROW = "->";

    public EinsumFormat {
        List<List<Character>> copies = new ArrayList<>(inputs.size());
        for (List<Character> labels : inputs) {
            copies.add(List.copyOf(labels));
        }
        inputs = Collections.unmodifiableList(copies);
        output = List.copyOf(output);
    }

    /**
     * Parse and validate a format string.
     *
     * @throws IllegalArgumentException if the arrow is missing, an operand or the output repeats a
     *                                  label, or an output label appears in no operand
     */
    public static EinsumFormat parse(String format) {
        int arrow = format.indexOf(ARROW);
        if (arrow < 0) {
            throw new IllegalArgumentException("format string must contain '->': " + format);
        }
        String inputsStr = format.substring(0, arrow).strip();
        String outputStr = format.substring(arrow + ARROW.length()).strip();
        if (outputStr.contains(ARROW)) {
            throw new IllegalArgumentException("format string has more than one '->': " + format);
        }

        List<List<Character>> inputs = new ArrayList<>();
        for (String operand : inputsStr.split(",", -1)) {
            List<Character> labels = labelsOf(operand.strip());
            requireDistinct(labels, "operand " + inputs.size());
            inputs.add(labels);
        }
        List<Character> output = labelsOf(outputStr);
        requireDistinct(output, "output");

        Set<Character> seen = new HashSet<>();
        inputs.forEach(seen::addAll);
        for (Character label : output) {
            if (!seen.contains(label)) {
                throw new IllegalArgumentException(
                    "output label '" + label + "' does not appear in any operand: " + format);
            }
        }
        return new EinsumFormat(inputs, output);
    }

    public int operandCount() {
        return inputs.size();
    }

    /**
     * The column-major twin of this format: every operand's labels and the output reversed.
     * Row-major {@code "ij,jk->ik"} becomes {@code "ji,kj->ki"}.
     */
    public EinsumFormat reversed() {
        List<List<Character>> reversedInputs = new ArrayList<>(inputs.size());
        for (List<Character> labels : inputs) {
            List<Character> copy = new ArrayList<>(labels);
            Collections.reverse(copy);
            reversedInputs.add(copy);
        }
        List<Character> reversedOutput = new ArrayList<>(output);
        Collections.reverse(reversedOutput);
        return new EinsumFormat(reversedInputs, reversedOutput);
    }

    public static List<Character> labelsOf(String labels) {
        List<Character> result = new ArrayList<>(labels.length());
        for (int i = 0; i < labels.length(); i++) {
            result.add(labels.charAt(i));
        }
        return result;
    }

    public static String labelString(List<Character> labels) {
        StringBuilder sb = new StringBuilder(labels.size());
        for (Character label : labels) {
            sb.append(label);
        }
        return sb.toString();
    }

    private static void requireDistinct(List<Character> labels, String what) {
        if (new HashSet<>(labels).size() != labels.size()) {
            throw new IllegalArgumentException(
                what + " repeats a label (diagonal extraction is not supported): " + labelString(labels));
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < inputs.size(); i++) {
            if (i > 0) sb.append(',');
            sb.append(labelString(inputs.get(i)));
        }
        return sb.append(ARROW).append(labelString(output)).toString();
    }
}
