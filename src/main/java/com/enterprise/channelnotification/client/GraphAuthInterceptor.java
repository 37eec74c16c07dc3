package com.enterprise.channelnotification.client;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;

/**
 * Adds an app-only bearer token to every Graph request.
 * Token caching and refresh are handled by the Azure Identity credential.
 */
public class GraphAuthInterceptor implements ClientHttpRequestInterceptor {
    
    static final String GRAPH_DEFAULT_SCOPE = "https://graph.microsoft.com/.default";
    
    private final TokenCredential credential;
    private final TokenRequestContext requestContext;
    
    public GraphAuthInterceptor(TokenCredential credential) {
        this.credential = credential;
        this.requestContext = new TokenRequestContext().addScopes(GRAPH_DEFAULT_SCOPE);
    }
    
    @Override
    public ClientHttpResponse intercept(
        HttpRequest request,
        byte[] body,
        ClientHttpRequestExecution execution
    ) throws IOException {
        AccessToken token = credential.getTokenSync(requestContext);
        request.getHeaders().set(HttpHeaders.AUTHORIZATION, "Bearer " + token.getToken());
        return execution.execute(request, body);
    }
}
