package io.breland.calhub.server.calendar.source.google;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.calendar.Calendar;
import io.breland.calhub.server.calendar.exceptions.BackendErrorKind;
import io.breland.calhub.server.calendar.exceptions.BackendException;
import io.breland.calhub.server.calendar.exceptions.CalendarConfigurationException;
import io.breland.calhub.server.calendar.model.EventSource;
import io.breland.calhub.server.config.CalendarProperties;
import java.io.IOException;
import java.security.GeneralSecurityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class GoogleCalendarClientFactory {
  static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

  private final CredentialProvider credentialProvider;
  private final String applicationName;

  public GoogleCalendarClientFactory(
      CredentialProvider credentialProvider, CalendarProperties properties) {
    this.credentialProvider = credentialProvider;
    this.applicationName = properties.getCloud().getApplicationName();
  }

  public boolean isConfigured() {
    return credentialProvider.isConfigured();
  }

  /** A client authorized with the stored credential. */
  public Calendar calendar() {
    if (!isConfigured()) {
      throw new CalendarConfigurationException("Google Calendar client not configured");
    }
    Credential credential;
    try {
      credential = credentialProvider.loadCredential();
    } catch (IOException e) {
      throw new BackendException(
          EventSource.CLOUD,
          BackendErrorKind.UNAUTHORIZED,
          "Failed to load Google credential: " + e.getMessage(),
          e);
    }
    try {
      NetHttpTransport httpTransport = GoogleNetHttpTransport.newTrustedTransport();
      return new Calendar.Builder(httpTransport, JSON_FACTORY, credential)
          .setApplicationName(applicationName)
          .build();
    } catch (GeneralSecurityException | IOException e) {
      throw new BackendException(
          EventSource.CLOUD, BackendErrorKind.NETWORK, "Failed to create calendar client", e);
    }
  }
}
