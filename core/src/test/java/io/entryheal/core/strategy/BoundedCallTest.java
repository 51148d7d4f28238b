package io.entryheal.core.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class BoundedCallTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void returnsResult() throws Exception {
        assertThat(BoundedCall.run(executor, () -> "ok", Duration.ofSeconds(1))).isEqualTo("ok");
    }

    @Test
    void timesOutAndInterruptsTheCall() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> BoundedCall.run(
                        executor,
                        () -> {
                            try {
                                Thread.sleep(10_000);
                            } catch (InterruptedException e) {
                                interrupted.countDown();
                            }
                            return "late";
                        },
                        Duration.ofMillis(50)))
                .isInstanceOf(TimeoutException.class);

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void propagatesFailure() {
        assertThatThrownBy(() -> BoundedCall.run(
                        executor,
                        () -> {
                            throw new IllegalStateException("boom");
                        },
                        Duration.ofSeconds(1)))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void asyncExecutorDoesNotRunInline() throws Exception {
        BoundedCall<String> call = BoundedCall.start(executor, () -> "ok");

        assertThat(call.await(System.nanoTime() + TimeUnit.SECONDS.toNanos(1))).isEqualTo("ok");
        assertThat(call.ranInline()).isFalse();
    }

    @Test
    void inlineExecutorIsReportedBecauseTheTimeoutCannotApply() throws Exception {
        Logger logger = (Logger) LoggerFactory.getLogger(BoundedCall.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            BoundedCall<String> call = BoundedCall.start(Runnable::run, () -> "done");

            assertThat(call.ranInline()).isTrue();
            assertThat(call.await(System.nanoTime())).isEqualTo("done");
            assertThat(appender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.WARN);
                        assertThat(event.getFormattedMessage())
                                .startsWith("bounded_call.inline")
                                .contains("timeout not enforced");
                    });
        } finally {
            logger.detachAppender(appender);
            appender.stop();
        }
    }
}
