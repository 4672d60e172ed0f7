package au.org.ala.raster.control;

import au.org.ala.raster.TestBase;
import com.google.common.base.Ticker;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class ControlChannelTest extends TestBase {

    private static class ManualTicker extends Ticker {
        long nanos = 0;

        @Override
        public long read() {
            return nanos;
        }

        void advance(Duration d) {
            nanos += d.toNanos();
        }
    }

    private final List<String> terminations = new ArrayList<>();
    private final ManualTicker ticker = new ManualTicker();
    private RunState state;
    private ControlChannel channel;

    @Before
    public void setUp() {
        state = new RunState();
        channel = new ControlChannel(state, terminations::add, Duration.ofSeconds(3), ticker);
    }

    @Test
    public void pauseToggles() {
        channel.onCommand(ControlCommand.PAUSE);
        assertEquals(RunState.Mode.PAUSED, state.getMode());
        channel.onCommand(ControlCommand.PAUSE);
        assertEquals(RunState.Mode.RUNNING, state.getMode());
        assertFalse(state.isSaveRequested());
    }

    @Test
    public void saveIgnoredWhileRunning() {
        channel.onCommand(ControlCommand.SAVE);
        assertEquals(RunState.Mode.RUNNING, state.getMode());
        assertFalse(state.isSaveRequested());
    }

    @Test
    public void saveWhilePausedResumesWithSaveFlag() throws Exception {
        channel.onCommand(ControlCommand.PAUSE);
        channel.onCommand(ControlCommand.SAVE);
        assertEquals(RunState.Mode.RUNNING, state.getMode());
        assertTrue(state.isSaveRequested());
        assertTrue(state.awaitWhilePaused(Duration.ofMillis(10)));
        state.acknowledgeSave();
        assertFalse(state.isSaveRequested());
    }

    @Test
    public void pauseCancelsArmedExit() {
        channel.onCommand(ControlCommand.EXIT);
        assertEquals(RunState.Mode.EXIT_ARMED, state.getMode());
        assertTrue(state.isPaused());
        channel.onCommand(ControlCommand.PAUSE);
        assertEquals(RunState.Mode.RUNNING, state.getMode());
        assertTrue(terminations.isEmpty());
    }

    @Test
    public void secondExitInsideWindowTerminates() {
        channel.onCommand(ControlCommand.EXIT);
        ticker.advance(Duration.ofMillis(2900));
        channel.onCommand(ControlCommand.EXIT);
        assertEquals(1, terminations.size());
    }

    @Test
    public void secondExitAfterWindowRearms() {
        channel.onCommand(ControlCommand.EXIT);
        ticker.advance(Duration.ofSeconds(4));
        channel.onCommand(ControlCommand.EXIT);
        assertTrue(terminations.isEmpty());
        assertEquals(RunState.Mode.EXIT_ARMED, state.getMode());

        ticker.advance(Duration.ofSeconds(1));
        channel.onCommand(ControlCommand.EXIT);
        assertEquals(1, terminations.size());
    }

    @Test
    public void saveIgnoredWhileExitArmed() {
        channel.onCommand(ControlCommand.EXIT);
        channel.onCommand(ControlCommand.SAVE);
        assertEquals(RunState.Mode.EXIT_ARMED, state.getMode());
        assertFalse(state.isSaveRequested());
        assertTrue(terminations.isEmpty());
    }

    @Test
    public void interruptTerminatesFromAnyState() {
        channel.onCommand(ControlCommand.INTERRUPT);
        channel.onCommand(ControlCommand.PAUSE);
        channel.onCommand(ControlCommand.INTERRUPT);
        assertEquals(2, terminations.size());
    }

    @Test
    public void readerBlocksUntilResumed() throws Exception {
        channel.onCommand(ControlCommand.PAUSE);
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean released = new AtomicBoolean(false);
        Thread reader = new Thread(() -> {
            started.countDown();
            try {
                state.awaitWhilePaused(Duration.ofMillis(5));
                released.set(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        reader.start();
        assertTrue(started.await(1, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertFalse("reader ran while paused", released.get());

        channel.onCommand(ControlCommand.PAUSE);
        reader.join(2000);
        assertTrue(released.get());
    }

    @Test
    public void keysMapToCommands() {
        assertEquals(ControlCommand.PAUSE, ControlCommand.fromKey('p').get());
        assertEquals(ControlCommand.PAUSE, ControlCommand.fromKey('P').get());
        assertEquals(ControlCommand.SAVE, ControlCommand.fromKey('s').get());
        assertEquals(ControlCommand.EXIT, ControlCommand.fromKey('e').get());
        assertEquals(ControlCommand.INTERRUPT, ControlCommand.fromKey(3).get());
        assertFalse(ControlCommand.fromKey('x').isPresent());
    }
}
