package com.dealplatform.negotiation.session;

import com.dealplatform.common.agent.NegotiationAdvice;
import com.dealplatform.common.model.CounterProposal;
import com.dealplatform.common.model.OfferTerms;

/**
 * Decides how far a round's feedback is from the offer it answers. Swappable so the
 * convergence rule stays a configured policy rather than logic buried in the round loop.
 */
public interface AcceptancePolicy {

    GapAssessment assess(OfferTerms standing, String feedback, CounterProposal counterProposal,
                         NegotiationAdvice advice);
}
