package com.mk.fx.qa.ws.benchmark.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.ws.benchmark.client.protocol.PusherWireProtocol;
import com.mk.fx.qa.ws.benchmark.client.protocol.WireProtocol;
import com.mk.fx.qa.ws.benchmark.runner.HostResolver;
import com.mk.fx.qa.ws.benchmark.runner.ScenarioRunner;
import com.mk.fx.qa.ws.benchmark.runner.TransportFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BenchmarkCfg {

  @Bean
  @ConditionalOnMissingBean
  public WireProtocol wireProtocol() {
    return new PusherWireProtocol();
  }

  @Bean
  @ConditionalOnMissingBean
  public TransportFactory transportFactory() {
    return TransportFactory.WEBSOCKET;
  }

  @Bean
  @ConditionalOnMissingBean
  public HostResolver hostResolver() {
    return HostResolver.SYSTEM;
  }

  @Bean
  public ScenarioRunner scenarioRunner(
      WireProtocol wireProtocol,
      TransportFactory transportFactory,
      HostResolver hostResolver,
      ObjectMapper objectMapper) {
    return new ScenarioRunner(wireProtocol, transportFactory, hostResolver, objectMapper);
  }
}
