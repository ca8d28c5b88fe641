package edu.stanford.docstore.examples;

import com.codahale.metrics.Timer;
import com.codahale.metrics.UniformReservoir;
import edu.stanford.docstore.DatastoreClient;
import edu.stanford.docstore.Entity;
import edu.stanford.docstore.GrpcDatastoreApi;
import edu.stanford.docstore.Key;
import edu.stanford.docstore.PathElement;
import edu.stanford.docstore.client.ClientMetrics;
import edu.stanford.docstore.config.Config;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.experimental.UtilityClass;
import lombok.extern.flogger.Flogger;

/**
 * Writes greetings into a guestbook inside a transaction, prints the ids the server allocated for
 * them, and then removes the oldest ones in a non-transactional batch.
 */
@Flogger
@RequiredArgsConstructor
public final class GuestbookApp {
  @UtilityClass
  private static final class Metrics {
    Timer signGuestbook =
        ClientMetrics.registry.timer(
            "docstore-client.guestbook.sign", () -> new Timer(new UniformReservoir()));
  }

  public static final String GUESTBOOK_KIND = "Guestbook";
  public static final String GREETING_KIND = "Greeting";
  public static final int KEEP_GREETINGS = 10;

  private final DatastoreClient client;
  private final String guestbookName;

  public static void main(String[] args) throws Exception {
    if (args.length < 3) {
      log.atSevere().log(
          "Invalid usage. Usage: guestbook-app <config_file> <guestbook> <greeting>...");
      System.exit(-1);
    }
    var configFile = new File(args[0]);
    if (!configFile.exists()) {
      log.atSevere().log("File %s does not exist", configFile.getAbsolutePath());
      System.exit(-2);
    }

    var config = Config.loadClientConfig(configFile);
    log.atInfo().log("Loaded client config %s", config);
    if (config.getMetricsPath() != null) {
      ClientMetrics.startReporting(
          Config.resolveRelativeToConfigFile(configFile, config.getMetricsPath()));
    }

    try (var client = DatastoreClient.create(config)) {
      var app = new GuestbookApp(client, args[1]);
      var greetings = List.of(args).subList(2, args.length);
      // separate RPC timings for each phase
      GrpcDatastoreApi.Timers.recreateTimers("sign");
      var keys = app.sign(greetings);
      for (var key : keys) {
        System.out.println(key);
      }
      GrpcDatastoreApi.Timers.recreateTimers("trim");
      app.trim(keys);
    } finally {
      ClientMetrics.stopReporting();
    }
  }

  /** Stores each greeting under this guestbook and returns their allocated keys. */
  public List<Key> sign(List<String> greetings) {
    var entities = new ArrayList<Entity>(greetings.size());
    try (var timer = Metrics.signGuestbook.time()) {
      var txn = client.transaction();
      txn.run(
          () -> {
            var guestbook = new Entity(client.key(PathElement.of(GUESTBOOK_KIND, guestbookName)));
            guestbook.set("greetingCount", (long) greetings.size());
            txn.put(guestbook);
            for (var text : greetings) {
              var greeting =
                  new Entity(
                      client.key(
                          PathElement.of(GUESTBOOK_KIND, guestbookName),
                          PathElement.of(GREETING_KIND)));
              greeting.set("content", text);
              greeting.set("date", System.currentTimeMillis());
              // staged through the client, lands in the transaction since it is current
              client.put(greeting);
              entities.add(greeting);
            }
          });
    }
    log.atInfo().log("Signed guestbook %s with %d greetings", guestbookName, entities.size());
    return entities.stream().map(Entity::getKey).toList();
  }

  /** Deletes all but the newest {@link #KEEP_GREETINGS} of {@code keys}. */
  public void trim(List<Key> keys) {
    if (keys.size() <= KEEP_GREETINGS) {
      return;
    }
    var stale = keys.subList(0, keys.size() - KEEP_GREETINGS);
    client.batch().run(() -> client.deleteMulti(stale));
    log.atInfo().log("Deleted %d old greetings", stale.size());
  }
}
