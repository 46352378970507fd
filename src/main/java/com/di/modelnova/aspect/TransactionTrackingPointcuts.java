package com.di.modelnova.aspect;

import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.stereotype.Component;

/**
 * Pointcuts for {@link ProjectTransactionTrackingAspect}.
 */
@Aspect
@Component
public class TransactionTrackingPointcuts {

    /**
     * Every public method on a REST controller (one per API request).
     */
    @Pointcut("@within(org.springframework.web.bind.annotation.RestController) && execution(public * *(..))")
    public void restControllerMethods() {
    }

    /**
     * Public entry points of the lifecycle components: version registry, A/B manager, pipeline orchestrator,
     * retrain engine and production monitoring.
     */
    @Pointcut("execution(public * com.di.modelnova.lifecycle..*Service.*(..)) || "
            + "execution(public * com.di.modelnova.lifecycle.abtest.AbTestManager.*(..)) || "
            + "execution(public * com.di.modelnova.lifecycle.pipeline.PipelineOrchestrator.*(..)) || "
            + "execution(public * com.di.modelnova.lifecycle.retrain.RetrainTriggerEngine.*(..))")
    public void serviceMethods() {
    }
}
