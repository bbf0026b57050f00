package com.worklog.backend.config;

import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.timesheet")
public class TimesheetProperties {

  private String storeRoot =
      Path.of(System.getProperty("java.io.tmpdir"), "worklog", "snapshots").toString();

  private int lookbackDays = 5;
  private int contextSwitchThreshold = 2;
  private int defaultRangeDays = 5;
  private int maxRangeDays = 92;
  private int descriptionLimit = 500;
  private int fallbackSnippetLimit = 50;
  private String jiraProjectKey;
  private String githubUsername;
  private SourceProperties source = new SourceProperties();
  private SummarizerProperties summarizer = new SummarizerProperties();
  private EmployeeProperties employee = new EmployeeProperties();

  public String getStoreRoot() {
    return storeRoot;
  }

  public void setStoreRoot(String storeRoot) {
    this.storeRoot = storeRoot;
  }

  public Path storeRootPath() {
    return Path.of(storeRoot).toAbsolutePath().normalize();
  }

  public int getLookbackDays() {
    return lookbackDays;
  }

  public void setLookbackDays(int lookbackDays) {
    this.lookbackDays = lookbackDays;
  }

  public int getContextSwitchThreshold() {
    return contextSwitchThreshold;
  }

  public void setContextSwitchThreshold(int contextSwitchThreshold) {
    this.contextSwitchThreshold = contextSwitchThreshold;
  }

  public int getDefaultRangeDays() {
    return defaultRangeDays;
  }

  public void setDefaultRangeDays(int defaultRangeDays) {
    this.defaultRangeDays = defaultRangeDays;
  }

  public int getMaxRangeDays() {
    return maxRangeDays;
  }

  public void setMaxRangeDays(int maxRangeDays) {
    this.maxRangeDays = maxRangeDays;
  }

  public int getDescriptionLimit() {
    return descriptionLimit;
  }

  public void setDescriptionLimit(int descriptionLimit) {
    this.descriptionLimit = descriptionLimit;
  }

  public int getFallbackSnippetLimit() {
    return fallbackSnippetLimit;
  }

  public void setFallbackSnippetLimit(int fallbackSnippetLimit) {
    this.fallbackSnippetLimit = fallbackSnippetLimit;
  }

  public String getJiraProjectKey() {
    return jiraProjectKey;
  }

  public void setJiraProjectKey(String jiraProjectKey) {
    this.jiraProjectKey = jiraProjectKey;
  }

  public String getGithubUsername() {
    return githubUsername;
  }

  public void setGithubUsername(String githubUsername) {
    this.githubUsername = githubUsername;
  }

  public SourceProperties getSource() {
    return source;
  }

  public void setSource(SourceProperties source) {
    this.source = source != null ? source : new SourceProperties();
  }

  public SummarizerProperties getSummarizer() {
    return summarizer;
  }

  public void setSummarizer(SummarizerProperties summarizer) {
    this.summarizer = summarizer != null ? summarizer : new SummarizerProperties();
  }

  public EmployeeProperties getEmployee() {
    return employee;
  }

  public void setEmployee(EmployeeProperties employee) {
    this.employee = employee != null ? employee : new EmployeeProperties();
  }

  public static class SourceProperties {

    private Duration fetchTimeout = Duration.ofSeconds(60);
    private String jiraTool = "jira.get_activity";
    private String githubTool = "github.get_activity";
    private boolean fetchWorklogs = false;

    public Duration getFetchTimeout() {
      return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
      this.fetchTimeout = fetchTimeout;
    }

    public String getJiraTool() {
      return jiraTool;
    }

    public void setJiraTool(String jiraTool) {
      this.jiraTool = jiraTool;
    }

    public String getGithubTool() {
      return githubTool;
    }

    public void setGithubTool(String githubTool) {
      this.githubTool = githubTool;
    }

    public boolean isFetchWorklogs() {
      return fetchWorklogs;
    }

    public void setFetchWorklogs(boolean fetchWorklogs) {
      this.fetchWorklogs = fetchWorklogs;
    }
  }

  public static class SummarizerProperties {

    private boolean enabled = true;
    private int maxTokens = 150;
    private double temperature = 0.2d;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getMaxTokens() {
      return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
      this.maxTokens = maxTokens;
    }

    public double getTemperature() {
      return temperature;
    }

    public void setTemperature(double temperature) {
      this.temperature = temperature;
    }
  }

  public static class EmployeeProperties {

    private String employeeId = "";
    private String employeeName = "";
    private String authorizedHours = "8";
    private String billable = "Yes";
    private String role = "Developer";
    private String site = "Offshore";

    public String getEmployeeId() {
      return employeeId;
    }

    public void setEmployeeId(String employeeId) {
      this.employeeId = employeeId;
    }

    public String getEmployeeName() {
      return employeeName;
    }

    public void setEmployeeName(String employeeName) {
      this.employeeName = employeeName;
    }

    public String getAuthorizedHours() {
      return authorizedHours;
    }

    public void setAuthorizedHours(String authorizedHours) {
      this.authorizedHours = authorizedHours;
    }

    public String getBillable() {
      return billable;
    }

    public void setBillable(String billable) {
      this.billable = billable;
    }

    public String getRole() {
      return role;
    }

    public void setRole(String role) {
      this.role = role;
    }

    public String getSite() {
      return site;
    }

    public void setSite(String site) {
      this.site = site;
    }
  }
}
