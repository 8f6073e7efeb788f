package fr.lapetina.bulkwriter.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.bulkwriter.coordinator.Dispatcher;
import fr.lapetina.bulkwriter.domain.event.CoordinatorCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole consumer of the command ring buffer: applies every command to the dispatcher.
 *
 * Running on exactly one thread, it is the single owner of the backlog, the in-flight counter
 * and the open flag. Commands are cleared after processing so the slot can be reused.
 */
public final class CoordinatorCommandHandler implements EventHandler<CoordinatorCommand> {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorCommandHandler.class);

    private final Dispatcher dispatcher;

    public CoordinatorCommandHandler(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public void onEvent(CoordinatorCommand command, long sequence, boolean endOfBatch) {
        try {
            if (command.getType() == null) {
                log.warn("Skipping empty command: sequence={}", sequence);
                return;
            }
            switch (command.getType()) {
                case ENQUEUE -> dispatcher.onEnqueue(command.getPendingWrite());
                case BATCH_COMPLETED -> dispatcher.onBatchCompleted(command.getCompletion());
                case FLUSH -> dispatcher.onFlush(command.getDrainWaiter());
                case CLOSE -> dispatcher.onClose(command.getDrainWaiter());
                case WAKE -> dispatcher.onWake();
            }
        } catch (RuntimeException e) {
            log.error("Command failed: sequence={}, command={}", sequence, command, e);
            command.failWith(e);
        } finally {
            command.clear();
        }
    }
}
