package com.example.contentops.flowguard;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.contentops.flowguard.dao.InMemoryMonitoringStore;
import com.example.contentops.flowguard.dao.MonitoringStore;
import com.example.contentops.flowguard.health.HealthMonitorJob;
import com.example.contentops.flowguard.service.PipelineMonitor;
import com.example.contentops.flowguard.validator.StageValidatorRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = "flowguard.health.enabled=false")
class FlowGuardApplicationTests {

  @Autowired
  ApplicationContext context;

  @Test
  void contextLoads() {
    assertThat(context.getBean(PipelineMonitor.class).activeSessionCount()).isZero();
    assertThat(context.getBean(MonitoringStore.class)).isInstanceOf(InMemoryMonitoringStore.class);
    assertThat(context.getBean(StageValidatorRegistry.class).stageIds())
        .containsExactlyInAnyOrder("fetch", "knowledge", "generate", "voice", "avatar", "publish");
    assertThat(context.getBeansOfType(HealthMonitorJob.class)).isEmpty();
  }
}
