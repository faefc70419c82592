package io.breland.calhub.server.calendar.source.google;

import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.client.util.store.FileDataStoreFactory;
import com.google.api.services.calendar.CalendarScopes;
import io.breland.calhub.server.config.CalendarProperties;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads the token an earlier OAuth consent stored in a {@link FileDataStoreFactory} directory.
 * Issuing tokens is not handled here.
 */
@Slf4j
@Component
public class StoredCredentialProvider implements CredentialProvider {
  private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
  private static final Collection<String> SCOPES = List.of(CalendarScopes.CALENDAR);

  private final CalendarProperties.Cloud settings;
  private final AtomicBoolean warnedUnconfigured = new AtomicBoolean();

  public StoredCredentialProvider(CalendarProperties properties) {
    this.settings = properties.getCloud();
  }

  @Override
  public boolean isConfigured() {
    String clientSecretPath = settings.getClientSecretPath();
    boolean configuredPath =
        clientSecretPath != null
            && !clientSecretPath.isBlank()
            && Files.exists(Paths.get(clientSecretPath));
    String clientSecret = settings.getClientSecret();
    boolean directSecretConfigured = clientSecret != null && !clientSecret.isBlank();
    boolean configured = configuredPath || directSecretConfigured;
    if (configured) {
      warnedUnconfigured.set(false);
    } else if (warnedUnconfigured.compareAndSet(false, true)) {
      log.warn(
          "Google Calendar is not configured, no direct secret, path does not exist: {}",
          clientSecretPath);
    } else {
      log.debug("Google Calendar is still not configured");
    }
    return configured;
  }

  @Override
  public Credential loadCredential() throws IOException {
    GoogleAuthorizationCodeFlow flow = buildFlow();
    Credential credential = flow.loadCredential(settings.getUserId());
    if (credential == null) {
      throw new IOException(
          "No stored Google credential for user "
              + settings.getUserId()
              + " in "
              + settings.getCredentialStoreDir());
    }
    return credential;
  }

  private GoogleAuthorizationCodeFlow buildFlow() throws IOException {
    GoogleClientSecrets clientSecrets = loadClientSecrets();
    try {
      return new GoogleAuthorizationCodeFlow.Builder(
              GoogleNetHttpTransport.newTrustedTransport(), JSON_FACTORY, clientSecrets, SCOPES)
          .setDataStoreFactory(new FileDataStoreFactory(new File(settings.getCredentialStoreDir())))
          .setAccessType("offline")
          .build();
    } catch (GeneralSecurityException e) {
      throw new IOException("Failed to create Google HTTP transport", e);
    }
  }

  private GoogleClientSecrets loadClientSecrets() throws IOException {
    String clientSecretPath = settings.getClientSecretPath();
    if (clientSecretPath != null
        && !clientSecretPath.isBlank()
        && Files.exists(Paths.get(clientSecretPath))) {
      try (Reader reader =
          new InputStreamReader(new FileInputStream(clientSecretPath), StandardCharsets.UTF_8)) {
        return GoogleClientSecrets.load(JSON_FACTORY, reader);
      }
    }
    String clientSecret = settings.getClientSecret();
    if (clientSecret != null && !clientSecret.isBlank()) {
      return GoogleClientSecrets.load(JSON_FACTORY, new StringReader(clientSecret));
    }
    throw new IOException("Google client secrets are not configured");
  }
}
