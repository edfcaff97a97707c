package com.planner.strategy;

import com.planner.allocator.AllocationContext;
import com.planner.allocator.SlotSpan;
import com.planner.core.Task;
import com.planner.grid.WeeklySlotGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Dynamic-programming placement minimizing total lateness of deadline-bearing tasks.
 * <p>
 * Candidates are pending tasks with a deadline whose dependencies are placed, taken in
 * deadline order. Lateness is measured at the end of the span, trailing break included.
 * {@code cost(i, t)} is the least lateness for candidates {@code i..}
 * using grid positions from {@code t} on, where each candidate is either placed at a
 * free span starting at some position, or skipped at a cost of one full week. Placements
 * with positive lateness are not committed, since a late task breaks the deadline
 * ceiling; they are left to the next strategy.
 */
public class LatenessMinimizingStrategy implements AllocationStrategy {

    private static final Logger log = LoggerFactory.getLogger(LatenessMinimizingStrategy.class);

    static final long SKIP_PENALTY = WeeklySlotGrid.MINUTES_PER_WEEK;

    private static final byte IDLE = 0;
    private static final byte SKIP = 1;
    private static final byte PLACE = 2;

    @Override
    public String getName() {
        return StrategyType.LATENESS_DP.name();
    }

    @Override
    public void allocate(AllocationContext context) {
        List<Task> candidates = candidates(context);
        if (candidates.isEmpty()) {
            log.debug("No deadline-bearing tasks ready for lateness minimization");
            return;
        }

        WeeklySlotGrid grid = context.getGrid();
        int n = grid.size();
        int k = candidates.size();

        int[] floors = new int[k];
        int[] ceilings = new int[k];
        for (int i = 0; i < k; i++) {
            floors[i] = context.earliestStartIndex(candidates.get(i));
            ceilings[i] = context.dependentsCeiling(candidates.get(i));
        }

        long[][] cost = new long[k + 1][n + 1];
        byte[][] choice = new byte[k + 1][n + 1];
        SlotSpan[][] spanChoice = new SlotSpan[k][];

        for (int i = k - 1; i >= 0; i--) {
            Task task = candidates.get(i);
            int deadline = task.getDeadline().getAsInt();
            spanChoice[i] = new SlotSpan[n + 1];
            cost[i][n] = cost[i + 1][n] + SKIP_PENALTY;
            choice[i][n] = SKIP;
            for (int t = n - 1; t >= 0; t--) {
                long best = cost[i][t + 1];
                byte move = IDLE;

                long skip = cost[i + 1][t] + SKIP_PENALTY;
                if (skip < best) {
                    best = skip;
                    move = SKIP;
                }

                Optional<SlotSpan> span = feasibleSpan(context, task, t, floors[i], ceilings[i]);
                if (span.isPresent()) {
                    long lateness = Math.max(0, context.spanEndMinute(span.get()) - deadline);
                    long place = cost[i + 1][span.get().end()] + lateness;
                    if (place <= best) {
                        best = place;
                        move = PLACE;
                        spanChoice[i][t] = span.get();
                    }
                }
                cost[i][t] = best;
                choice[i][t] = move;
            }
        }

        log.debug("Lateness DP over {} task(s) and {} slots: minimal cost {}", k, n, cost[0][0]);
        commitPlan(context, candidates, choice, spanChoice, n);
    }

    private void commitPlan(AllocationContext context, List<Task> candidates,
                            byte[][] choice, SlotSpan[][] spanChoice, int n) {
        List<Task> plannedTasks = new ArrayList<>();
        List<SlotSpan> plannedSpans = new ArrayList<>();
        int i = 0;
        int t = 0;
        while (i < candidates.size()) {
            switch (choice[i][t]) {
                case IDLE -> t++;
                case SKIP -> i++;
                default -> {
                    SlotSpan span = spanChoice[i][t];
                    plannedTasks.add(candidates.get(i));
                    plannedSpans.add(span);
                    t = span.end();
                    i++;
                }
            }
            if (t > n) {
                break;
            }
        }

        int committed = 0;
        for (int p = 0; p < plannedTasks.size(); p++) {
            Task task = plannedTasks.get(p);
            SlotSpan span = plannedSpans.get(p);
            int deadline = task.getDeadline().getAsInt();
            if (context.spanEndMinute(span) > deadline) {
                log.debug("Lateness DP leaves {} for later: best window ends {} minute(s) late",
                        task.getId(), context.spanEndMinute(span) - deadline);
                continue;
            }
            context.commit(task, span);
            committed++;
        }
        log.debug("Lateness DP committed {} of {} candidate(s)", committed, candidates.size());
    }

    private static Optional<SlotSpan> feasibleSpan(AllocationContext context, Task task,
                                                   int start, int floor, int ceiling) {
        if (start < floor) {
            return Optional.empty();
        }
        Optional<SlotSpan> span = context.spanAt(task, start);
        if (span.isEmpty()) {
            return Optional.empty();
        }
        SlotSpan s = span.get();
        if (context.endMinute(s) > ceiling || !context.getGrid().isFree(s.start(), s.end())) {
            return Optional.empty();
        }
        return span;
    }

    private static List<Task> candidates(AllocationContext context) {
        List<Task> result = new ArrayList<>();
        for (Task task : context.pendingTasks()) {
            if (task.getDeadline().isPresent()
                    && task.requiredMinutes().isPresent()
                    && !task.isFixed()
                    && context.dependenciesReady(task)) {
                result.add(task);
            }
        }
        result.sort(Comparator.comparingInt(t -> t.getDeadline().getAsInt()));
        return result;
    }
}
