package fr.lapetina.bulkwriter.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating CoordinatorCommand instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates commands at startup; they are reused by clearing and refilling them.
 */
public final class CoordinatorCommandFactory implements EventFactory<CoordinatorCommand> {

    @Override
    public CoordinatorCommand newInstance() {
        return new CoordinatorCommand();
    }
}
