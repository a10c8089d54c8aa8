package com.dealplatform.negotiation.session;

/** Where the client's price expectation for a round was read from. */
public enum ExpectationSource {
    COUNTER_PROPOSAL,
    FEEDBACK_FIGURE,
    AGREEMENT,
    AGENT_LIKELIHOOD
}
