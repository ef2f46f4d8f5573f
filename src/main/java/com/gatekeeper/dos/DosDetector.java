package com.gatekeeper.dos;

/**
 * Cheap per-IP screen that runs before any rate limit is consulted.
 */
public interface DosDetector {

    /**
     * Records one request from {@code ip} and reports whether the IP is currently
     * considered abusive (including while a previous ban is still running).
     */
    boolean isAttack(String ip);

    /**
     * @return seconds left on the ban of {@code ip}, 0 when it is not banned
     */
    long banRemainingSeconds(String ip);

    static DosDetector disabled() {
        return new DosDetector() {
            @Override
            public boolean isAttack(String ip) {
                return false;
            }

            @Override
            public long banRemainingSeconds(String ip) {
                return 0;
            }
        };
    }
}
