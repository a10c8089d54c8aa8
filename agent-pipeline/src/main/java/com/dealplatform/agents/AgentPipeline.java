package com.dealplatform.agents;

import com.dealplatform.agents.agent.MarketAnalysisAgent;
import com.dealplatform.agents.agent.NegotiationAgent;
import com.dealplatform.agents.agent.OfferStructuringAgent;
import com.dealplatform.agents.agent.TradeInEvaluationAgent;
import com.dealplatform.agents.context.MarketAnalysisContext;
import com.dealplatform.agents.context.NegotiationContext;
import com.dealplatform.agents.context.OfferStructuringContext;
import com.dealplatform.agents.context.TradeInContext;
import com.dealplatform.agents.invoke.AgentInvoker;
import com.dealplatform.common.agent.MarketAnalysis;
import com.dealplatform.common.agent.NegotiationAdvice;
import com.dealplatform.common.agent.OfferStructuringResult;
import com.dealplatform.common.agent.TradeInEvaluation;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Entry point to the four reasoning roles. Each call is one invocation under the shared
 * timeout and retry policy; failures surface as
 * {@link com.dealplatform.common.exception.AgentFailureException}.
 */
@Service
public class AgentPipeline {

    private final AgentInvoker           invoker;
    private final MarketAnalysisAgent    marketAnalysisAgent;
    private final TradeInEvaluationAgent tradeInEvaluationAgent;
    private final OfferStructuringAgent  offerStructuringAgent;
    private final NegotiationAgent       negotiationAgent;

    public AgentPipeline(AgentInvoker invoker,
                         MarketAnalysisAgent marketAnalysisAgent,
                         TradeInEvaluationAgent tradeInEvaluationAgent,
                         OfferStructuringAgent offerStructuringAgent,
                         NegotiationAgent negotiationAgent) {
        this.invoker                = invoker;
        this.marketAnalysisAgent    = marketAnalysisAgent;
        this.tradeInEvaluationAgent = tradeInEvaluationAgent;
        this.offerStructuringAgent  = offerStructuringAgent;
        this.negotiationAgent       = negotiationAgent;
    }

    public Mono<MarketAnalysis> analyzeMarket(MarketAnalysisContext context) {
        return invoker.invoke(marketAnalysisAgent, context);
    }

    public Mono<TradeInEvaluation> evaluateTradeIn(TradeInContext context) {
        return invoker.invoke(tradeInEvaluationAgent, context);
    }

    public Mono<OfferStructuringResult> structureOffers(OfferStructuringContext context) {
        return invoker.invoke(offerStructuringAgent, context);
    }

    public Mono<NegotiationAdvice> negotiate(NegotiationContext context) {
        return invoker.invoke(negotiationAgent, context);
    }
}
