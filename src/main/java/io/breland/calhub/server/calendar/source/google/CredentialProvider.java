package io.breland.calhub.server.calendar.source.google;

import com.google.api.client.auth.oauth2.Credential;
import java.io.IOException;

/** Supplies an already-issued Google OAuth credential. */
public interface CredentialProvider {

  boolean isConfigured();

  Credential loadCredential() throws IOException;
}
