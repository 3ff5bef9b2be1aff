package io.relay.spring.boot;

import io.relay.idempotency.AcquireResult;
import io.relay.idempotency.IdempotencyConflictException;
import io.relay.idempotency.IdempotencyGate;
import io.relay.idempotency.IdempotencyLockedException;
import io.relay.idempotency.LockToken;
import io.relay.idempotency.RequestFingerprint;
import io.relay.model.CachedResponse;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.Principal;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Servlet filter applying the {@link IdempotencyGate} to mutating requests that carry an
 * {@value #IDEMPOTENCY_KEY} header.
 *
 * <p>GET, HEAD and OPTIONS requests and requests without the header pass through untouched.
 * For the rest, the request body is buffered and fingerprinted and the gate decides:
 * <ul>
 *   <li>proceed: the chain runs; a response below 500 is stored, a 5xx or an exception
 *       releases the key;</li>
 *   <li>replay: the stored response is written with {@value #REPLAYED}{@code : true};</li>
 *   <li>conflict: 422 {@code idempotency_key_reused};</li>
 *   <li>locked: 409 {@code idempotency_request_in_progress}.</li>
 * </ul>
 */
public class IdempotencyFilter extends OncePerRequestFilter {
  private static final Logger logger = Logger.getLogger(IdempotencyFilter.class.getName());

  public static final String IDEMPOTENCY_KEY = "Idempotency-Key";
  public static final String REPLAYED = "Idempotent-Replayed";
  static final int MAX_KEY_LENGTH = 255;

  private static final Set<String> GATED_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

  private final IdempotencyGate gate;
  private final ScopeResolver scopeResolver;

  public IdempotencyFilter(IdempotencyGate gate) {
    this(gate, ScopeResolver.PRINCIPAL_AND_PATH);
  }

  public IdempotencyFilter(IdempotencyGate gate, ScopeResolver scopeResolver) {
    this.gate = Objects.requireNonNull(gate, "gate");
    this.scopeResolver = Objects.requireNonNull(scopeResolver, "scopeResolver");
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !GATED_METHODS.contains(request.getMethod()) || request.getHeader(IDEMPOTENCY_KEY) == null;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {
    String key = request.getHeader(IDEMPOTENCY_KEY).trim();
    if (key.isEmpty() || key.length() > MAX_KEY_LENGTH) {
      writeError(response, HttpServletResponse.SC_BAD_REQUEST, "idempotency_key_invalid",
          IDEMPOTENCY_KEY + " must be 1-" + MAX_KEY_LENGTH + " characters");
      return;
    }

    BufferedBodyRequest buffered = new BufferedBodyRequest(request);
    String scope = scopeResolver.resolve(request);
    String hash = RequestFingerprint.of(request.getMethod(), request.getRequestURI(), buffered.body);

    AcquireResult result = gate.acquire(key, scope, hash);
    if (result instanceof AcquireResult.Replay replay) {
      writeReplay(response, replay.response());
      return;
    }
    if (result instanceof AcquireResult.Conflict) {
      writeError(response, IdempotencyConflictException.HTTP_STATUS,
          IdempotencyConflictException.ERROR_CODE,
          "Idempotency key was already used with a different request");
      return;
    }
    if (result instanceof AcquireResult.Locked) {
      writeError(response, IdempotencyLockedException.HTTP_STATUS,
          IdempotencyLockedException.ERROR_CODE,
          "A request with this idempotency key is in progress");
      return;
    }
    LockToken lockToken = ((AcquireResult.Proceed) result).lockToken();

    ContentCachingResponseWrapper captured = new ContentCachingResponseWrapper(response);
    try {
      filterChain.doFilter(buffered, captured);
    } catch (IOException | ServletException | RuntimeException e) {
      release(lockToken, e);
      throw e;
    }

    int status = captured.getStatus();
    if (status >= 500) {
      release(lockToken, null);
    } else {
      String body = new String(captured.getContentAsByteArray(), charsetOf(captured));
      gate.complete(lockToken, new CachedResponse(status, captured.getContentType(), body));
    }
    captured.copyBodyToResponse();
  }

  private void release(LockToken lockToken, Exception failure) {
    try {
      gate.release(lockToken);
    } catch (RuntimeException e) {
      if (failure != null) {
        failure.addSuppressed(e);
      } else {
        logger.log(Level.SEVERE, "Failed to release idempotency key " + lockToken.key(), e);
      }
    }
  }

  private static void writeReplay(HttpServletResponse response, CachedResponse cached) throws IOException {
    response.setStatus(cached.status());
    response.setHeader(REPLAYED, "true");
    if (cached.contentType() != null) {
      response.setContentType(cached.contentType());
    }
    if (cached.body() != null) {
      byte[] bytes = cached.body().getBytes(charsetOf(response));
      response.setContentLength(bytes.length);
      response.getOutputStream().write(bytes);
    }
  }

  private static void writeError(HttpServletResponse response, int status, String code, String message)
      throws IOException {
    response.setStatus(status);
    response.setContentType("application/json");
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.getWriter().write("{\"error\":{\"code\":\"" + code + "\",\"message\":\"" + message + "\"}}");
  }

  private static Charset charsetOf(HttpServletResponse response) {
    String encoding = response.getCharacterEncoding();
    if (encoding == null) {
      return StandardCharsets.UTF_8;
    }
    try {
      return Charset.forName(encoding);
    } catch (IllegalArgumentException e) {
      return StandardCharsets.UTF_8;
    }
  }

  /** Derives the idempotency scope of a request. */
  @FunctionalInterface
  public interface ScopeResolver {
    /** Authenticated principal name (or {@code anonymous}) plus the request path. */
    ScopeResolver PRINCIPAL_AND_PATH = request -> {
      Principal principal = request.getUserPrincipal();
      String owner = principal != null ? principal.getName() : "anonymous";
      return owner + ":" + request.getRequestURI();
    };

    String resolve(HttpServletRequest request);
  }

  /** Request whose body has been read once and is served again to the chain. */
  private static final class BufferedBodyRequest extends HttpServletRequestWrapper {
    private final byte[] body;

    private BufferedBodyRequest(HttpServletRequest request) throws IOException {
      super(request);
      this.body = request.getInputStream().readAllBytes();
    }

    @Override
    public ServletInputStream getInputStream() {
      ByteArrayInputStream in = new ByteArrayInputStream(body);
      return new ServletInputStream() {
        @Override
        public boolean isFinished() {
          return in.available() == 0;
        }

        @Override
        public boolean isReady() {
          return true;
        }

        @Override
        public void setReadListener(ReadListener readListener) {
          throw new UnsupportedOperationException("Async reads are not supported");
        }

        @Override
        public int read() {
          return in.read();
        }

        @Override
        public int read(byte[] b, int off, int len) {
          return in.read(b, off, len);
        }
      };
    }

    @Override
    public BufferedReader getReader() {
      String encoding = getCharacterEncoding();
      Charset charset = encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
      return new BufferedReader(new InputStreamReader(getInputStream(), charset));
    }
  }
}
