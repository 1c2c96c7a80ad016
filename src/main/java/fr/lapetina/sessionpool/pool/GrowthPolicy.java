package fr.lapetina.sessionpool.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether the pool may start another worker: below the soft cap it always may,
 * between the soft and hard caps only when the admission signal agrees.
 */
public final class GrowthPolicy {

    private static final Logger log = LoggerFactory.getLogger(GrowthPolicy.class);

    private final SessionPool pool;
    private final int softMaxWorkers;
    private final AdmissionSignal admissionSignal;

    public GrowthPolicy(SessionPool pool, int softMaxWorkers, AdmissionSignal admissionSignal) {
        this.pool = pool;
        this.softMaxWorkers = Math.min(softMaxWorkers, pool.getMaxWorkers());
        this.admissionSignal = admissionSignal != null ? admissionSignal : AdmissionSignal.ALWAYS;
    }

    public boolean permitsGrowth() {
        if (!pool.hasCapacity()) {
            return false;
        }
        int current = pool.size();
        if (current < softMaxWorkers) {
            return true;
        }
        boolean admitted = admissionSignal.admitBeyondSoftCap(current);
        if (!admitted) {
            log.debug("Growth beyond soft cap refused: workers={}, softMax={}", current, softMaxWorkers);
        }
        return admitted;
    }

    public int getSoftMaxWorkers() {
        return softMaxWorkers;
    }
}
