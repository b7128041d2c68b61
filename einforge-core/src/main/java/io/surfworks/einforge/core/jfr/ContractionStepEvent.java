package io.surfworks.einforge.core.jfr;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event recording one binary step of a contraction path.
 *
 * <p>The event duration covers the backend contraction call. Usage:
 * <pre>{@code
 * ContractionStepEvent event = new ContractionStepEvent();
 * event.begin();
 * Tensor result = backend.contract(...);
 * event.end();
 * if (event.shouldCommit()) {
 *     event.stepIndex = k;
 *     event.outputLabels = "ik";
 *     event.commit();
 * }
 * }</pre>
 */
@Name("io.surfworks.einforge.ContractionStep")
@Label("Contraction Step")
@Category({"Einforge", "Contraction"})
@Description("Records one pairwise contraction of a path evaluation")
public class ContractionStepEvent extends Event {

    @Label("Step Index")
    @Description("Zero-based position of the step in the path")
    public int stepIndex;

    @Label("First Position")
    @Description("Lower operand list position consumed by the step")
    public int firstPosition;

    @Label("Second Position")
    @Description("Higher operand list position consumed by the step")
    public int secondPosition;

    @Label("Left Labels")
    @Description("Labels of the operand at the lower position")
    public String leftLabels;

    @Label("Right Labels")
    @Description("Labels of the operand at the higher position")
    public String rightLabels;

    @Label("Output Labels")
    @Description("Labels surviving the step, in first-seen order")
    public String outputLabels;

    @Label("Result Elements")
    @Description("Element count of the produced tensor")
    public long resultElements;

    @Label("Live Operands")
    @Description("Operand list size after the step")
    public int liveOperands;

    @Label("Backend")
    @Description("Backend that executed the contraction")
    public String backend;
}
