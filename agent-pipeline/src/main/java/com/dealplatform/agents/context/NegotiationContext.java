package com.dealplatform.agents.context;

import com.dealplatform.common.model.ClientProfile;
import com.dealplatform.common.model.CounterProposal;
import com.dealplatform.common.model.NegotiationRound;
import com.dealplatform.common.model.OfferTerms;
import com.dealplatform.common.model.OfferType;

import java.util.List;

/**
 * Input of the negotiation role for one round.
 *
 * <p>{@code roundNumber} is the number the round will carry once committed;
 * {@code history} holds the rounds already committed, oldest first;
 * {@code offerTypes} are the types a revised offer may take.
 */
public record NegotiationContext(
    ClientProfile          client,
    OfferTerms             currentOffer,
    String                 feedback,
    CounterProposal        counterProposal,
    List<NegotiationRound> history,
    int                    roundNumber,
    int                    maxRounds,
    double                 costBasis,
    double                 marginTarget,
    List<OfferType>        offerTypes
) {

    public NegotiationContext {
        history = List.copyOf(history);
        offerTypes = List.copyOf(offerTypes);
    }

    public boolean isFinalEffort() {
        return roundNumber == maxRounds - 1;
    }
}
