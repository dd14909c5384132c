package com.di.etlcontrol.config;

import com.di.etlcontrol.monitor.EtlRun;
import com.di.etlcontrol.monitor.MonitorProperties;
import com.di.etlcontrol.monitor.StageMonitor;
import com.di.etlcontrol.retry.RetryPolicy;
import com.di.etlcontrol.typemap.TableDesignMapper;
import com.di.etlcontrol.typemap.TableSelector;
import com.di.etlcontrol.typemap.TypeResolver;
import com.di.etlcontrol.typemap.TypeRuleTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the control core from the loaded settings. A malformed type map, table selection or retry
 * section fails bean creation, so the application does not start on bad settings.
 */
@Slf4j
@Configuration
public class EtlControlConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EtlSettings etlSettings(EtlSettingsLoaderService loader) {
        return loader.load();
    }

    @Bean
    public TypeRuleTable typeRuleTable(EtlSettings etlSettings) {
        return TypeRuleTable.fromSettings(etlSettings.getTypeMaps());
    }

    @Bean
    public TypeResolver typeResolver(TypeRuleTable typeRuleTable) {
        return new TypeResolver(typeRuleTable);
    }

    @Bean
    public TableDesignMapper tableDesignMapper(TypeResolver typeResolver) {
        return new TableDesignMapper(typeResolver);
    }

    @Bean
    public TableSelector tableSelector(EtlSettings etlSettings) {
        return TableSelector.fromSettings(etlSettings.getTableSelection());
    }

    @Bean
    public RetryPolicy retryPolicy(EtlSettings etlSettings) {
        RetryPolicy policy = RetryPolicy.fromSettings(etlSettings.getRetry());
        log.info("[SETTINGS] Retry budgets: extract={}, copy={}, insert={}",
                policy.getExtractRetries(), policy.getCopyDataRetries(), policy.getInsertDataRetries());
        return policy;
    }

    @Bean
    public EtlRun etlRun(Clock clock, MonitorProperties monitorProperties) {
        EtlRun run = EtlRun.start(clock, monitorProperties.getEventCapacity());
        log.info("[MONITOR] Started run {}", run.getEtlId());
        return run;
    }

    @Bean
    public StageMonitor stageMonitor(EtlRun etlRun) {
        return new StageMonitor(etlRun.getEventLog());
    }
}
