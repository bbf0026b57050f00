package com.worklog.mcp.backend;

import com.worklog.mcp.backend.config.GitHubBackendProperties;
import com.worklog.mcp.backend.config.InsightBackendProperties;
import com.worklog.mcp.backend.config.JiraBackendProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;

/** Activity MCP server. Each tool group is switched on by its Spring profile. */
@SpringBootApplication(scanBasePackages = "com.worklog.mcp.backend.config")
@Import({
  McpApplication.JiraConfig.class,
  McpApplication.GitHubConfig.class,
  McpApplication.InsightConfig.class
})
public class McpApplication {

  public static void main(String[] args) {
    SpringApplication.run(McpApplication.class, args);
  }

  @Configuration
  @Profile("jira")
  @ComponentScan(basePackages = {"com.worklog.mcp.backend.jira", "com.worklog.mcp.backend.config"})
  @EnableConfigurationProperties(JiraBackendProperties.class)
  public static class JiraConfig {}

  @Configuration
  @Profile("github")
  @ComponentScan(
      basePackages = {"com.worklog.mcp.backend.github", "com.worklog.mcp.backend.config"})
  @EnableConfigurationProperties(GitHubBackendProperties.class)
  public static class GitHubConfig {}

  @Configuration
  @Profile("insight")
  @ComponentScan(
      basePackages = {"com.worklog.mcp.backend.insight", "com.worklog.mcp.backend.config"})
  @EnableConfigurationProperties(InsightBackendProperties.class)
  public static class InsightConfig {}
}
