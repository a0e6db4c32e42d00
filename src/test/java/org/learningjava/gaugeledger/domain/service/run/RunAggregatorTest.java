package org.learningjava.gaugeledger.domain.service.run;

import org.junit.jupiter.api.Test;
import org.learningjava.gaugeledger.domain.model.run.ResultRecord;
import org.learningjava.gaugeledger.domain.service.run.RunAggregator.RunTotals;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunAggregatorTest {

    private static ResultRecord r(String task, String variant, boolean success, double score, int passedAttempt) {
        return new ResultRecord(task, variant, "m", "p", success, score, passedAttempt, 100, 60, 40, 0.25, 1000);
    }

    @Test
    void summarize_countsDistinctTasksAndVariants_andPassRates() {
        RunTotals t = RunAggregator.summarize(List.of(
                r("T1", "A", true, 100, 1),
                r("T2", "A", true, 80, 2),
                r("T1", "B", true, 60, 3),
                r("T2", "B", false, 0, 0)));

        assertEquals(2, t.totalTasks());
        assertEquals(2, t.totalModels());
        assertEquals(1.0, t.totalCost(), 1e-9);
        assertEquals(400, t.totalTokens());
        assertEquals(4000, t.totalDurationMs());
        assertEquals(0.25, t.passRate1(), 1e-9);
        assertEquals(0.5, t.passRate2(), 1e-9);
        assertEquals(0.75, t.overallPassRate(), 1e-9);
        assertEquals(60.0, t.averageScore(), 1e-9);
    }

    @Test
    void summarize_emptyRun_isAllZeros() {
        assertEquals(RunTotals.EMPTY, RunAggregator.summarize(List.of()));
    }

    @Test
    void summarize_rejectsNull() {
        assertThrows(NullPointerException.class, () -> RunAggregator.summarize(null));
    }
}
