package com.skylarkarms.cell;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublishedCellLifecycleTest {

    @Test
    void exitHookIsRegisteredOnceAndReleasedByTeardown() {
        PublishedCell<String> cell = PublishedCell.of(() -> "exit");

        cell.tearDownOnExit();
        Thread hook = cell.exitHook;
        assertThat(hook).isNotNull();
        assertThat(cell.tearDownOnExit()).isSameAs(cell);
        assertThat(cell.exitHook).isSameAs(hook);

        assertThat(cell.tearDown()).isTrue();

        assertThat(cell.exitHook).isNull();
        assertThat(Runtime.getRuntime().removeShutdownHook(hook)).isFalse();
    }

    @Test
    void exitHookOnATornDownCellIsNotKept() {
        PublishedCell<String> cell = PublishedCell.of(() -> "gone");
        cell.tearDown();

        cell.tearDownOnExit();

        assertThat(cell.exitHook).isNull();
    }

    @Test
    void exitHookTearsDownExactlyOnce() {
        AtomicInteger destructions = new AtomicInteger();
        PublishedCell<String> cell = new PublishedCell<>(s -> destructions.incrementAndGet());
        cell.construct(() -> "hooked");
        cell.tearDownOnExit();
        Thread hook = cell.exitHook;

        hook.run();
        hook.run();
        cell.close();

        assertThat(destructions).hasValue(1);
        assertThat(cell.isTornDown()).isTrue();
        assertThat(Runtime.getRuntime().removeShutdownHook(hook)).isFalse();
    }

    @Test
    void provenanceIsReportedWhenCaptured() {
        PublishedCell<String> cell = new PublishedCell<>(Destructor.noDestruct(), Locks.Config.DEFAULT_CONFIG, null, true);
        assertThat(cell.es).isNotEmpty();

        assertThatThrownBy(() -> cell.get(Locks.ExceptionConfig.timeout(20)))
                .isInstanceOf(TimeoutException.class)
                .cause()
                .hasMessageContaining(">> stack {")
                .hasMessageContaining(PublishedCellLifecycleTest.class.getName());

        cell.construct(() -> "traced");
        assertThatThrownBy(() -> cell.construct(() -> "twice"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at = ")
                .hasMessageContaining("provenanceIsReportedWhenCaptured");
        assertThat(cell.toStringDetailed())
                .contains(">>> provenance=")
                .contains("total length = " + cell.es.length);

        cell.tearDown();
        assertThatThrownBy(cell::get)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(">> stack {");
    }

    @Test
    void withoutProvenanceFailuresPointToTheDebugSwitch() {
        PublishedCell<String> cell = new PublishedCell<>(Destructor.noDestruct(), Locks.Config.DEFAULT_CONFIG, null, false);
        assertThat(cell.es).isNull();

        assertThatThrownBy(() -> cell.get(Locks.ExceptionConfig.timeout(20)))
                .isInstanceOf(TimeoutException.class)
                .cause()
                .hasMessageContaining("setDebug(true)")
                .hasMessageNotContaining(">> stack {");
        assertThat(cell.toStringDetailed()).doesNotContain("provenance");
    }
}
