package com.eainde.truckticket.batch;

import com.eainde.truckticket.model.ProcessingRun;
import com.eainde.truckticket.model.RunStatus;
import com.eainde.truckticket.repository.ProcessingRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class ProcessingRunLedgerTest {

    private static final Instant START = Instant.parse("2024-11-15T12:00:00Z");

    @Mock
    private ProcessingRunRepository runs;

    private ProcessingRunLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new ProcessingRunLedger(runs, Clock.fixed(START, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("start inserts an open run with its configuration snapshot")
    void start() {
        ProcessingRun run = ledger.start("run-1", 3, "nightly", Map.of("workers", 4));

        verify(runs).insert(run);
        assertThat(run.status()).isEqualTo(RunStatus.IN_PROGRESS);
        assertThat(run.startedAt()).isEqualTo(START);
        assertThat(run.processedBy()).isEqualTo("nightly");
        assertThat(run.configSnapshot()).containsEntry("workers", 4);
    }

    @Test
    @DisplayName("every finished file is added to the totals and stored")
    void recordFile() {
        ledger.start("run-1", 3, "nightly", Map.of());

        ledger.recordFile(FileResult.ok(Path.of("a.pdf"), 1, 4, 3, 1, 1, List.of(1L, 2L, 3L)));
        ledger.recordFile(FileResult.error(Path.of("b.pdf"), 3, "OCR down"));
        ProcessingRun run = ledger.recordFile(FileResult.skipped(Path.of("c.pdf")));

        ArgumentCaptor<ProcessingRun> updates = ArgumentCaptor.forClass(ProcessingRun.class);
        verify(runs, times(3)).update(updates.capture());
        assertThat(updates.getAllValues()).extracting(ProcessingRun::pagesCount).containsExactly(4, 4, 4);
        assertThat(run.okCount()).isEqualTo(3);
        assertThat(run.errorCount()).isEqualTo(1);
        assertThat(run.reviewCount()).isEqualTo(1);
        assertThat(run.duplicatesFound()).isEqualTo(1);
    }

    @Test
    @DisplayName("a sealed run is stored once and refuses further files")
    void seal() {
        ledger.start("run-1", 1, "nightly", Map.of());

        ProcessingRun sealed = ledger.seal(RunStatus.COMPLETED);

        verify(runs).update(sealed);
        assertThat(sealed.completedAt()).isEqualTo(START);
        assertThat(sealed.isSealed()).isTrue();
        assertThatThrownBy(() -> ledger.recordFile(FileResult.skipped(Path.of("late.pdf"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already sealed");
        assertThat(ledger.fail(new IllegalStateException("late failure"))).isSameAs(sealed);
    }

    @Test
    @DisplayName("fail seals an open run as FAILED")
    void fail() {
        ProcessingRun started = ledger.start("run-1", 1, "nightly", Map.of());

        ProcessingRun failed = ledger.fail(new IllegalStateException("pool rejected task"));

        assertThat(failed.status()).isEqualTo(RunStatus.FAILED);
        verify(runs).insert(started);
        verify(runs).update(failed);
        verifyNoMoreInteractions(runs);
    }
}
