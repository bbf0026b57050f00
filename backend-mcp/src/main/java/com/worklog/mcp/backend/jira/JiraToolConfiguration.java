package com.worklog.mcp.backend.jira;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class JiraToolConfiguration {

  @Bean
  ToolCallbackProvider jiraToolCallbackProvider(JiraActivityTools tools) {
    return MethodToolCallbackProvider.builder().toolObjects(tools).build();
  }
}
