package com.coherenceai;

import com.coherenceai.application.coherence.CoherenceAppService;
import com.coherenceai.infrastructure.config.EngineConfigurationHolder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.task.TaskSchedulingProperties;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class CoherenceAiApplicationTests {

    @Autowired
    private CoherenceAppService coherenceAppService;

    @Autowired
    private EngineConfigurationHolder configurationHolder;

    @Autowired
    private TaskSchedulingProperties schedulingProperties;

    @Test
    void contextLoads() {
        assertThat(coherenceAppService).isNotNull();
        assertThat(configurationHolder.current().ruleSet().size()).isPositive();
    }

    @Test
    void knowledge_retries_do_not_share_a_single_scheduler_thread_with_config_reload() {
        assertThat(schedulingProperties.getPool().getSize()).isGreaterThanOrEqualTo(2);
    }
}
