/*
 * Copyright (c) 2025 Moataz Hussein
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.kestrelsoft.relay;

import static com.github.kestrelsoft.relay.internal.Utils.requireValidToken;
import static java.util.Objects.requireNonNull;

/**
 * An interceptor that sets the {@code Authorization} header of each attempt to {@code <scheme>
 * <credential>}. The credential is requested anew on every attempt, so a retry after an expired
 * token goes out with whatever the provider returns then.
 *
 * <pre>{@code
 * var client = RelayClient.newBuilder()
 *     .interceptor(AuthorizationInterceptor.bearer(request -> tokenStore.currentToken()))
 *     .build();
 * }</pre>
 */
public final class AuthorizationInterceptor implements Interceptor {
  private final String scheme;
  private final CredentialProvider credentialProvider;

  private AuthorizationInterceptor(String scheme, CredentialProvider credentialProvider) {
    this.scheme = requireValidToken(scheme);
    this.credentialProvider = requireNonNull(credentialProvider);
  }

  /**
   * Sets the request's {@code Authorization} header.
   *
   * @throws Exception if the provider fails to supply a credential, which fails the call with
   *     {@link HttpFailure.Kind#PREPARATION}
   */
  @Override
  public void prepare(MutableRequest request, Context context) throws Exception {
    var credential = credentialProvider.credential(request.toImmutableRequest());
    request.setHeader(Header.AUTHORIZATION, scheme + " " + credential);
  }

  @Override
  public String toString() {
    return "AuthorizationInterceptor[scheme=" + scheme + "]";
  }

  /** Returns an interceptor that authorizes requests with the given scheme. */
  public static AuthorizationInterceptor of(String scheme, CredentialProvider credentialProvider) {
    return new AuthorizationInterceptor(scheme, credentialProvider);
  }

  /** Returns an interceptor that authorizes requests with bearer tokens. */
  public static AuthorizationInterceptor bearer(CredentialProvider tokenProvider) {
    return new AuthorizationInterceptor("Bearer", tokenProvider);
  }

  /** Supplies the credentials of requests. Called from the thread executing the call. */
  @FunctionalInterface
  public interface CredentialProvider {

    /**
     * Returns the credential for the given request. May block, e.g. to refresh an expired token.
     */
    String credential(Request request) throws Exception;
  }
}
