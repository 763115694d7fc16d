package ilhost.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 默认宿主：通过 java.util.logging 输出，延迟任务按 FIFO 排队。
 */
public class LoggingHost implements Host {

    private static final Logger LOG = Logger.getLogger(LoggingHost.class.getName());

    private final Deque<Runnable> pending = new ArrayDeque<>();

    @Override
    public void warning(String message) {
        LOG.warning(message);
    }

    @Override
    public void error(Throwable error) {
        LOG.log(Level.SEVERE, error.getMessage(), error);
    }

    @Override
    public void runLater(Runnable action) {
        synchronized (pending) {
            pending.addLast(action);
        }
    }

    @Override
    public int runPending() {
        int count = 0;
        while (true) {
            Runnable next;
            synchronized (pending) {
                next = pending.pollFirst();
            }
            if (next == null) return count;
            try {
                next.run();
            } catch (RuntimeException e) {
                error(e);
            }
            count++;
        }
    }
}
