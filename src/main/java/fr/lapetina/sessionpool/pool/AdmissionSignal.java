package fr.lapetina.sessionpool.pool;

/**
 * External hint consulted before the pool grows past its soft cap,
 * for example a host resource monitor. The hard cap is never exceeded.
 */
@FunctionalInterface
public interface AdmissionSignal {

    AdmissionSignal ALWAYS = currentWorkers -> true;

    /**
     * @param currentWorkers workers registered right now
     * @return true if one more worker may be started
     */
    boolean admitBeyondSoftCap(int currentWorkers);
}
