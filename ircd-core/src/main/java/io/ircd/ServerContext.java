package io.ircd;

import io.ircd.config.ConnectClass;
import io.ircd.config.OperInfo;
import io.ircd.config.ServerConfig;
import io.ircd.entity.LocalUser;
import io.ircd.entity.Membership;
import io.ircd.entity.Server;
import io.ircd.entity.User;
import io.ircd.entity.UserDirectory;
import io.ircd.event.AuthenticationAttempt;
import io.ircd.event.ConnectClassSelection;
import io.ircd.event.CoreEvents;
import io.ircd.event.DispatchInterceptor;
import io.ircd.event.EventDispatcher;
import io.ircd.event.EventOutcome;
import io.ircd.event.GatewayAuthentication;
import io.ircd.event.PostConnect;
import io.ircd.event.WhoLine;
import io.ircd.event.WhoRequest;
import io.ircd.event.WhoisContext;
import io.ircd.ext.Extensible;
import io.ircd.ext.ExtensionRegistry;
import io.ircd.ext.ExtensionReplicator;
import io.ircd.ext.MalformedValuePolicy;
import io.ircd.loop.CompletionQueue;
import io.ircd.module.Module;
import io.ircd.module.ModuleManager;
import io.ircd.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Root object of a running server: owns the extension registry, the event dispatcher,
 * the module manager and the entities, and raises the core events.
 *
 * <p>Every component receives the context (or the parts it needs) explicitly; there is
 * no process-wide instance, so tests can build as many isolated servers as they like.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (ServerContext server = ServerContext.builder()
 *     .config(config)
 *     .module(new SslInfoModule())
 *     .build()) {
 *   LocalUser user = ...;
 *   server.users().add(user);
 *   server.selectConnectClass(user);
 *   server.postConnect(user);
 * }
 * }</pre>
 */
public final class ServerContext implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ServerContext.class.getName());

  private final ServerConfig config;
  private final Server localServer;
  private final ExtensionRegistry extensions;
  private final ExtensionReplicator replicator;
  private final EventDispatcher dispatcher;
  private final UserDirectory users;
  private final CompletionQueue completions;
  private final ModuleManager modules;
  private final MetricsExporter metrics;

  private ServerContext(Builder builder) {
    this.config = builder.config != null ? builder.config : ServerConfig.builder().build();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.localServer = new Server(config.serverName(), builder.serverId);
    this.extensions = ExtensionRegistry.builder()
        .malformedValuePolicy(builder.malformedValuePolicy)
        .metrics(metrics)
        .build();
    this.replicator = new ExtensionReplicator(extensions);
    this.dispatcher = EventDispatcher.builder()
        .metrics(metrics)
        .interceptors(builder.interceptors)
        .build();
    this.users = new UserDirectory();
    this.completions = new CompletionQueue(builder.completionQueueCapacity);
    this.modules = new ModuleManager(extensions, dispatcher, config, users, completions);
  }

  public static Builder builder() {
    return new Builder();
  }

  public ServerConfig config() {
    return config;
  }

  public Server localServer() {
    return localServer;
  }

  public ExtensionRegistry extensions() {
    return extensions;
  }

  public ExtensionReplicator replicator() {
    return replicator;
  }

  public EventDispatcher dispatcher() {
    return dispatcher;
  }

  public UserDirectory users() {
    return users;
  }

  public CompletionQueue completions() {
    return completions;
  }

  public ModuleManager modules() {
    return modules;
  }

  // ── Entity lifecycle ────────────────────────────────────────────

  /**
   * Releases every extension value of an entity and makes it inert. Users are also
   * removed from the directory.
   *
   * @param entity the entity being discarded
   */
  public void destroy(Extensible entity) {
    if (entity instanceof User user) {
      users.remove(user);
    }
    extensions.onEntityDestroyed(entity);
  }

  // ── Core actions ────────────────────────────────────────────────

  /**
   * Picks the first configured connect class no listener denies and assigns it.
   *
   * @param user the connecting user
   * @return the chosen class, or empty if every class was denied
   */
  public Optional<ConnectClass> selectConnectClass(LocalUser user) {
    for (ConnectClass candidate : config.connectClasses()) {
      EventOutcome outcome = dispatcher.dispatch(CoreEvents.CONNECT_CLASS_SELECTION,
          new ConnectClassSelection(user, candidate));
      if (outcome.orDefault(EventOutcome.ALLOW) == EventOutcome.ALLOW) {
        user.setConnectClass(candidate);
        return Optional.of(candidate);
      }
    }
    logger.fine(() -> "No connect class accepted " + user);
    return Optional.empty();
  }

  /**
   * Marks a user as registered and announces it.
   */
  public void postConnect(LocalUser user) {
    user.setRegistered(true);
    dispatcher.dispatch(CoreEvents.POST_CONNECT, new PostConnect(user));
  }

  /**
   * Handles an operator login after the password was checked.
   *
   * <p>Listeners may refuse the login; they are expected to tell the user why. Without
   * an objection the login succeeds if an oper block with that name exists.
   *
   * @param user  the user sending {@code OPER}
   * @param login the requested oper block name
   * @return {@code true} if the user is now an operator
   */
  public boolean authenticateOper(LocalUser user, String login) {
    Optional<OperInfo> block = config.operBlock(login);
    EventOutcome outcome = dispatcher.dispatch(CoreEvents.AUTHENTICATION_ATTEMPT,
        new AuthenticationAttempt(user, login, block.orElse(null)));
    if (outcome == EventOutcome.DENY) {
      return false;
    }
    if (block.isEmpty()) {
      user.writeNumeric(Numerics.ERR_NOOPERHOST, "Invalid oper credentials");
      return false;
    }
    user.operUp(block.get(), "using OPER");
    return true;
  }

  /**
   * Collects the module-provided WHOIS lines about {@code target} and sends them to
   * {@code source}.
   *
   * @return the context, with the lines that were sent
   */
  public WhoisContext whois(User source, User target) {
    WhoisContext whois = new WhoisContext(source, target);
    dispatcher.dispatch(CoreEvents.WHOIS, whois);
    for (WhoisContext.Line line : whois.lines()) {
      source.writeNumeric(line.numeric(), target.nick(), line.text());
    }
    return whois;
  }

  /**
   * Lets listeners edit or hide one WHO reply line.
   *
   * @param params the line's parameters
   * @return the edited parameters, or empty if a listener hid the line
   */
  public Optional<List<String>> whoLine(WhoRequest request, LocalUser source, User user,
      Membership membership, List<String> params) {
    WhoLine line = new WhoLine(request, source, user, membership, params);
    EventOutcome outcome = dispatcher.dispatch(CoreEvents.WHO_LINE, line);
    return outcome == EventOutcome.DENY ? Optional.empty() : Optional.of(List.copyOf(line.params()));
  }

  /**
   * Announces that a WebIRC gateway authenticated a user.
   *
   * @param flags gateway connection flags, or null if none were sent
   */
  public void gatewayAuthenticated(LocalUser user, Map<String, String> flags) {
    dispatcher.dispatch(CoreEvents.GATEWAY_FLAG_ANNOUNCEMENT, new GatewayAuthentication(user, flags));
  }

  /**
   * Unloads every module (releasing their extension values), then closes the metrics
   * exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      modules.unloadAll();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link ServerContext}.
   */
  public static final class Builder {
    private ServerConfig config;
    private String serverId = "001";
    private MalformedValuePolicy malformedValuePolicy = MalformedValuePolicy.TOLERATE;
    private MetricsExporter metrics;
    private int completionQueueCapacity = 1024;
    private final List<DispatchInterceptor> interceptors = new ArrayList<>();
    private final List<Module> modules = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the configuration. Optional; defaults to an empty configuration.
     *
     * @param config the configuration
     * @return this builder
     */
    public Builder config(ServerConfig config) {
      this.config = config;
      return this;
    }

    public Builder serverId(String serverId) {
      this.serverId = Objects.requireNonNull(serverId, "serverId");
      return this;
    }

    /**
     * Sets how undecodable extension values from linked servers are handled.
     *
     * <p>Optional. Defaults to {@link MalformedValuePolicy#TOLERATE}.
     *
     * @param malformedValuePolicy the policy
     * @return this builder
     */
    public Builder malformedValuePolicy(MalformedValuePolicy malformedValuePolicy) {
      this.malformedValuePolicy = Objects.requireNonNull(malformedValuePolicy, "malformedValuePolicy");
      return this;
    }

    /**
     * Sets the metrics exporter. Optional; defaults to {@link MetricsExporter#NOOP}.
     * Closed together with the context if it implements {@link AutoCloseable}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder completionQueueCapacity(int completionQueueCapacity) {
      this.completionQueueCapacity = completionQueueCapacity;
      return this;
    }

    public Builder interceptor(DispatchInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Adds a module to load when the context is built. Modules load in the order added.
     *
     * @param module the module
     * @return this builder
     */
    public Builder module(Module module) {
      this.modules.add(Objects.requireNonNull(module, "module"));
      return this;
    }

    public Builder modules(List<? extends Module> modules) {
      modules.forEach(this::module);
      return this;
    }

    /**
     * Builds the context and loads the configured modules.
     *
     * @return a new context
     * @throws io.ircd.module.ModuleActivationException if a module fails to load; modules
     *     loaded before it are unloaded again
     * @throws IllegalArgumentException if {@code completionQueueCapacity <= 0}
     */
    public ServerContext build() {
      ServerContext context = new ServerContext(this);
      try {
        for (Module module : modules) {
          context.modules.load(module);
        }
      } catch (RuntimeException e) {
        try {
          context.close();
        } catch (RuntimeException closeFailure) {
          e.addSuppressed(closeFailure);
        }
        throw e;
      }
      return context;
    }
  }
}
