package fr.lapetina.inference.gateway.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link IngressEvent} slots for the ring buffer.
 */
public final class IngressEventFactory implements EventFactory<IngressEvent> {

    @Override
    public IngressEvent newInstance() {
        return new IngressEvent();
    }
}
