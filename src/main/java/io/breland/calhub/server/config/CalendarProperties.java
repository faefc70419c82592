package io.breland.calhub.server.config;

import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.calendar.model.WorkingHours;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "calendar")
public class CalendarProperties {

  private String timeZone = ZoneId.systemDefault().getId();
  private String workingHoursStart = "09:00";
  private String workingHoursEnd = "18:00";
  private List<DayOfWeek> deepWorkDays = new ArrayList<>();
  private List<DayOfWeek> meetingHeavyDays = new ArrayList<>();
  private int maxParticipants = 20;
  private int defaultMinSlotMinutes = 25;
  private int defaultMaxSlotMinutes = 480;
  private int defaultCommonSlotMinutes = 30;
  private final Os os = new Os();
  private final Cloud cloud = new Cloud();
  private final Retry retry = new Retry();

  public ZoneId zoneId() {
    return ZoneId.of(timeZone);
  }

  public WorkingHours workingHours() {
    return WorkingHours.parse(workingHoursStart, workingHoursEnd);
  }

  public boolean isEnabled(EventSource source) {
    return switch (source) {
      case OS -> os.isEnabled();
      case CLOUD -> cloud.isEnabled();
    };
  }

  public String getTimeZone() {
    return timeZone;
  }

  public void setTimeZone(String timeZone) {
    if (timeZone == null || timeZone.isBlank()) {
      this.timeZone = ZoneId.systemDefault().getId();
      return;
    }
    this.timeZone = timeZone;
  }

  public String getWorkingHoursStart() {
    return workingHoursStart;
  }

  public void setWorkingHoursStart(String workingHoursStart) {
    this.workingHoursStart = workingHoursStart;
  }

  public String getWorkingHoursEnd() {
    return workingHoursEnd;
  }

  public void setWorkingHoursEnd(String workingHoursEnd) {
    this.workingHoursEnd = workingHoursEnd;
  }

  public List<DayOfWeek> getDeepWorkDays() {
    return deepWorkDays;
  }

  public void setDeepWorkDays(List<DayOfWeek> deepWorkDays) {
    this.deepWorkDays = deepWorkDays != null ? deepWorkDays : new ArrayList<>();
  }

  public List<DayOfWeek> getMeetingHeavyDays() {
    return meetingHeavyDays;
  }

  public void setMeetingHeavyDays(List<DayOfWeek> meetingHeavyDays) {
    this.meetingHeavyDays = meetingHeavyDays != null ? meetingHeavyDays : new ArrayList<>();
  }

  public int getMaxParticipants() {
    return maxParticipants;
  }

  public void setMaxParticipants(int maxParticipants) {
    this.maxParticipants = maxParticipants;
  }

  public int getDefaultMinSlotMinutes() {
    return defaultMinSlotMinutes;
  }

  public void setDefaultMinSlotMinutes(int defaultMinSlotMinutes) {
    this.defaultMinSlotMinutes = defaultMinSlotMinutes;
  }

  public int getDefaultMaxSlotMinutes() {
    return defaultMaxSlotMinutes;
  }

  public void setDefaultMaxSlotMinutes(int defaultMaxSlotMinutes) {
    this.defaultMaxSlotMinutes = defaultMaxSlotMinutes;
  }

  public int getDefaultCommonSlotMinutes() {
    return defaultCommonSlotMinutes;
  }

  public void setDefaultCommonSlotMinutes(int defaultCommonSlotMinutes) {
    this.defaultCommonSlotMinutes = defaultCommonSlotMinutes;
  }

  public Os getOs() {
    return os;
  }

  public Cloud getCloud() {
    return cloud;
  }

  public Retry getRetry() {
    return retry;
  }

  static boolean runningOnMac() {
    return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
  }

  public static class Os {
    private Boolean enabled;
    private String command = "osascript";
    private Duration scriptTimeout = Duration.ofSeconds(30);

    /** Defaults to on for macOS hosts only. */
    public boolean isEnabled() {
      return enabled != null ? enabled : runningOnMac();
    }

    public void setEnabled(Boolean enabled) {
      this.enabled = enabled;
    }

    public String getCommand() {
      return command;
    }

    public void setCommand(String command) {
      this.command = command;
    }

    public Duration getScriptTimeout() {
      return scriptTimeout;
    }

    public void setScriptTimeout(Duration scriptTimeout) {
      this.scriptTimeout = scriptTimeout;
    }
  }

  public static class Cloud {
    private Boolean enabled;
    private String defaultCalendar = "primary";
    private String applicationName = "Calendar Hub";
    private String clientSecretPath = "";
    private String clientSecret = "";
    private String credentialStoreDir =
        System.getProperty("user.home") + "/.calendar-hub/credentials";
    private String userId = "default";
    private int pageSize = 250;
    private int freebusyBatchSize = 50;

    /** Defaults to on everywhere except macOS, where the local store is preferred. */
    public boolean isEnabled() {
      return enabled != null ? enabled : !runningOnMac();
    }

    public void setEnabled(Boolean enabled) {
      this.enabled = enabled;
    }

    public String getDefaultCalendar() {
      return defaultCalendar;
    }

    public void setDefaultCalendar(String defaultCalendar) {
      this.defaultCalendar = defaultCalendar;
    }

    public String getApplicationName() {
      return applicationName;
    }

    public void setApplicationName(String applicationName) {
      this.applicationName = applicationName;
    }

    public String getClientSecretPath() {
      return clientSecretPath;
    }

    public void setClientSecretPath(String clientSecretPath) {
      this.clientSecretPath = clientSecretPath;
    }

    public String getClientSecret() {
      return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
    }

    public String getCredentialStoreDir() {
      return credentialStoreDir;
    }

    public void setCredentialStoreDir(String credentialStoreDir) {
      this.credentialStoreDir = credentialStoreDir;
    }

    public String getUserId() {
      return userId;
    }

    public void setUserId(String userId) {
      this.userId = userId;
    }

    public int getPageSize() {
      return pageSize;
    }

    public void setPageSize(int pageSize) {
      this.pageSize = pageSize;
    }

    public int getFreebusyBatchSize() {
      return freebusyBatchSize;
    }

    public void setFreebusyBatchSize(int freebusyBatchSize) {
      this.freebusyBatchSize = freebusyBatchSize;
    }
  }

  public static class Retry {
    private int maxAttempts = 3;
    private Duration initialDelay = Duration.ofSeconds(1);
    private double multiplier = 2.0;
    private Duration maxDelay = Duration.ofSeconds(30);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }
  }
}
