package com.scylladb.admin.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.scylladb.admin.AdminConfig;
import com.scylladb.admin.ClusterAdmin;
import com.scylladb.admin.FanOutPolicy;
import com.scylladb.admin.cluster.ClusterConfig;
import com.scylladb.admin.cluster.ClusterConfigLoader;
import com.scylladb.admin.errors.AdminException;
import com.scylladb.admin.explain.ExplainEngine;
import com.scylladb.admin.explain.ExplainRequest;
import com.scylladb.admin.internal.Json;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Supplier;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import net.sourceforge.argparse4j.inf.Subparsers;

/**
 * Command line front end of {@link ClusterAdmin}. Results are printed as JSON.
 *
 * <p>Usage: {@code java -cp cluster-admin.jar com.scylladb.admin.cli.AdminCli --cluster
 * id=prod,discovery=http://discovery:15000,vtctld=http://vtctld:15000/api tablets}
 */
public class AdminCli {
  private static final Logger logger = Logger.getLogger(AdminCli.class.getName());

  /** Creates the admin instance a command runs against. */
  @FunctionalInterface
  interface AdminFactory {
    ClusterAdmin create(List<ClusterConfig> clusters, AdminConfig config);
  }

  private final AdminFactory factory;

  public AdminCli() {
    this(
        (clusters, config) ->
            ClusterAdmin.builder().withClusterConfigs(clusters).withConfig(config).build());
  }

  AdminCli(AdminFactory factory) {
    this.factory = factory;
  }

  public static void main(String[] args) {
    System.exit(new AdminCli().run(args, System.out, System.err));
  }

  static ArgumentParser newParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("cluster-admin")
            .build()
            .defaultHelp(true)
            .description("Query many clusters at once");

    parser
        .addArgument("--cluster")
        .action(Arguments.append())
        .help("Cluster as id=...,name=...,discovery=URI,vtctld=URI; may be repeated");
    parser.addArgument("--cluster-config").help("JSON file listing clusters");
    parser
        .addArgument("--timeout")
        .type(Long.class)
        .setDefault(AdminConfig.DEFAULT_REQUEST_TIMEOUT.getSeconds())
        .help("Request timeout in seconds");
    parser
        .addArgument("--fail-fast")
        .action(Arguments.storeTrue())
        .help("Cancel the remaining work of a request at the first failure");
    parser.addArgument("--verbose").action(Arguments.storeTrue()).help("Log request tracing");

    Subparsers commands = parser.addSubparsers().dest("command").title("commands");
    commands.addParser("clusters").help("List configured clusters");
    addFilter(commands.addParser("gates").help("List query gateways"));
    addFilter(commands.addParser("keyspaces").help("List keyspaces and their shards"));
    addFilter(commands.addParser("schemas").help("List table schemas"));
    addFilter(commands.addParser("tablets").help("List tablets"));

    Subparser tablet = commands.addParser("tablet").help("Show the tablet with a hostname");
    tablet.addArgument("hostname").help("Tablet hostname");
    addFilter(tablet);

    Subparser explain = commands.addParser("explain").help("Explain how a query is routed");
    explain
        .addArgument("--cluster-id")
        .dest("explain_cluster")
        .setDefault("")
        .help("Cluster id");
    explain.addArgument("--keyspace").setDefault("").help("Keyspace name");
    explain.addArgument("--sql").setDefault("").help("SQL to explain");
    return parser;
  }

  private static void addFilter(Subparser subparser) {
    subparser
        .addArgument("--cluster-id")
        .dest("cluster_ids")
        .action(Arguments.append())
        .help("Restrict to this cluster; may be repeated");
  }

  /**
   * Runs one command.
   *
   * @param args command line arguments
   * @param out receives the result
   * @param err receives error messages
   * @return the process exit status
   */
  public int run(String[] args, PrintStream out, PrintStream err) {
    ArgumentParser parser = newParser();
    Namespace ns;
    try {
      ns = parser.parseArgs(args);
    } catch (HelpScreenException e) {
      return 0;
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      return 1;
    }

    if (ns.getBoolean("verbose")) {
      enableTracing();
    }

    List<ClusterConfig> clusters;
    AdminConfig config;
    try {
      clusters = loadClusters(ns);
      config =
          AdminConfig.builder()
              .withRequestTimeout(Duration.ofSeconds(ns.getLong("timeout")))
              .withFanOutPolicy(
                  ns.getBoolean("fail_fast")
                      ? FanOutPolicy.FAIL_FAST
                      : FanOutPolicy.RUN_TO_COMPLETION)
              .withExplainEngineSupplier(engineSupplier())
              .build();
    } catch (IOException | IllegalArgumentException e) {
      err.println("error: " + e.getMessage());
      return 1;
    }
    if (clusters.isEmpty()) {
      err.println("error: no clusters configured, use --cluster or --cluster-config");
      return 1;
    }

    try (ClusterAdmin admin = factory.create(clusters, config)) {
      out.println(execute(admin, ns));
      return 0;
    } catch (AdminException e) {
      logger.log(Level.FINE, "Command failed", e);
      err.println("error: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      err.println("error: " + e.getMessage());
      return 1;
    }
  }

  private static String execute(ClusterAdmin admin, Namespace ns)
      throws AdminException, JsonProcessingException {
    List<String> ids = ns.getList("cluster_ids");
    String command = ns.getString("command");
    switch (command) {
      case "clusters":
        return Json.PRETTY_WRITER.writeValueAsString(admin.getClusters());
      case "gates":
        return Json.PRETTY_WRITER.writeValueAsString(admin.getGates(ids));
      case "keyspaces":
        return Json.PRETTY_WRITER.writeValueAsString(admin.getKeyspaces(ids));
      case "schemas":
        return Json.PRETTY_WRITER.writeValueAsString(admin.getSchemas(ids));
      case "tablets":
        return Json.PRETTY_WRITER.writeValueAsString(admin.getTablets(ids));
      case "tablet":
        return Json.PRETTY_WRITER.writeValueAsString(
            admin.getTablet(ns.getString("hostname"), ids));
      case "explain":
        return admin.explain(
            new ExplainRequest(
                ns.getString("explain_cluster"), ns.getString("keyspace"), ns.getString("sql")));
      default:
        throw new IllegalStateException("unhandled command: " + command);
    }
  }

  private static List<ClusterConfig> loadClusters(Namespace ns) throws IOException {
    List<ClusterConfig> clusters = new ArrayList<>();
    String file = ns.getString("cluster_config");
    if (file != null) {
      clusters.addAll(ClusterConfigLoader.load(Paths.get(file)));
    }
    List<String> specs = ns.getList("cluster");
    if (specs != null) {
      for (String spec : specs) {
        clusters.add(ClusterConfig.parse(spec));
      }
    }
    return clusters;
  }

  /** Returns a supplier of the first installed engine, or null if none is installed. */
  private static Supplier<ExplainEngine> engineSupplier() {
    if (!ServiceLoader.load(ExplainEngine.class).findFirst().isPresent()) {
      return null;
    }
    return () -> {
      Optional<ExplainEngine> engine = ServiceLoader.load(ExplainEngine.class).findFirst();
      return engine.orElseThrow(() -> new IllegalStateException("explain engine disappeared"));
    };
  }

  private static void enableTracing() {
    Logger root = Logger.getLogger("com.scylladb.admin");
    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(Level.FINE);
    root.setLevel(Level.FINE);
    root.addHandler(handler);
    root.setUseParentHandlers(false);
  }
}
