package com.workshopos.service;

import com.workshopos.config.OperatorSettings;
import com.workshopos.domain.OAuthApplication;
import com.workshopos.repository.OAuthApplicationRepository;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.apache.commons.lang3.RandomStringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * OAuth client records for workshop sessions, one per session and keyed by
 * the session name.
 */
@Singleton
public class OAuthApplicationService {

    static final List<String> SESSION_APPLICATIONS = List.of("console", "editor", "slides", "terminal");

    @Inject OAuthApplicationRepository applicationRepository;
    @Inject OperatorSettings operator;

    /** Must be called inside a transaction. */
    public OAuthApplication getOrCreate(String sessionName, List<String> ingresses) {
        return applicationRepository.findByName(sessionName).orElseGet(() -> {
            OAuthApplication application = new OAuthApplication();
            application.setName(sessionName);
            application.setClientId(sessionName);
            application.setClientSecret(RandomStringUtils.secure().nextAlphanumeric(32));
            application.setRedirectUris(String.join(" ", redirectUris(sessionName, ingresses)));
            return applicationRepository.save(application);
        });
    }

    /**
     * Wildcards are not allowed, so every host proxied through the session
     * gateway gets its own callback.
     */
    List<String> redirectUris(String sessionName, List<String> ingresses) {
        List<String> uris = new ArrayList<>();
        uris.add(callback(sessionName, null));
        for (String application : SESSION_APPLICATIONS) {
            uris.add(callback(sessionName, application));
        }
        for (String ingress : ingresses) {
            uris.add(callback(sessionName, ingress));
        }
        return uris;
    }

    private String callback(String sessionName, String suffix) {
        String host = suffix != null ? sessionName + "-" + suffix : sessionName;
        return operator.getIngressProtocol() + "://" + host + "." + operator.getIngressDomain() + "/oauth_callback";
    }
}
