package com.cdcbridge.config;

/**
 * What happens to windows that are still open when the input ends or the job is
 * stopped with {@code --drain}.
 */
public enum DrainPolicy {

    /** Fire every open window so its rows reach the sink. */
    FLUSH,

    /** Drop open windows without writing them. */
    DISCARD
}
