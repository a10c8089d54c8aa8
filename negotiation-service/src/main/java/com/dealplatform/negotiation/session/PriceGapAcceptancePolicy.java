package com.dealplatform.negotiation.session;

import com.dealplatform.common.agent.NegotiationAdvice;
import com.dealplatform.common.model.CounterProposal;
import com.dealplatform.common.model.FeedbackSignals;
import com.dealplatform.common.model.OfferTerms;
import com.dealplatform.negotiation.config.NegotiationPolicy;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Normalised price gap: {@code |standingPrice - expectation| / standingPrice}.
 *
 * <p>The expectation is read, in order, from the structured counter-proposal, from a price
 * figure in the feedback text, or from an agreement phrase (which means the standing price).
 * When none applies the agent's own estimate is used: {@code gap = 1 - acceptanceLikelihood}.
 */
@Component
public class PriceGapAcceptancePolicy implements AcceptancePolicy {

    private final double threshold;

    public PriceGapAcceptancePolicy(NegotiationPolicy policy) {
        this.threshold = policy.acceptanceThreshold();
    }

    @Override
    public GapAssessment assess(OfferTerms standing, String feedback, CounterProposal counterProposal,
                                NegotiationAdvice advice) {
        double price = standing.effectivePrice();

        if (counterProposal != null && counterProposal.expectedPrice() != null) {
            return priced(price, counterProposal.expectedPrice(), ExpectationSource.COUNTER_PROPOSAL);
        }
        Optional<Double> figure = FeedbackSignals.extractPrice(feedback);
        if (figure.isPresent()) {
            return priced(price, figure.get(), ExpectationSource.FEEDBACK_FIGURE);
        }
        if (FeedbackSignals.isAgreement(feedback)) {
            return priced(price, price, ExpectationSource.AGREEMENT);
        }
        double gap = clamp(1.0 - advice.acceptanceLikelihood());
        return new GapAssessment(null, ExpectationSource.AGENT_LIKELIHOOD, gap, gap <= threshold);
    }

    private GapAssessment priced(double price, double expectation, ExpectationSource source) {
        double gap = price <= 0 ? 1.0 : clamp(Math.abs(price - expectation) / price);
        return new GapAssessment(expectation, source, gap, gap <= threshold);
    }

    public double threshold() {
        return threshold;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
