package io.surfworks.einforge.backend.cpu.ops;

/**
 * Runs a {@link RangeTask} over {@code [0, total)}, possibly split across threads.
 * Returns only when every slice has finished.
 */
@FunctionalInterface
public interface RangeExecutor {

    RangeExecutor SEQUENTIAL = (total, task) -> task.run(0, total);

    void execute(long total, RangeTask task);
}
