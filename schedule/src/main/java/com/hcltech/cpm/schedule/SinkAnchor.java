package com.hcltech.cpm.schedule;

/** Late finish given to a task nothing waits on. */
public enum SinkAnchor {
    /** LF = EF of the task itself. */
    OWN_EARLY_FINISH,
    /** LF = project horizon, so short independent branches show their slack. */
    PROJECT_HORIZON
}
