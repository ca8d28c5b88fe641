package edu.stanford.docstore;

import com.codahale.metrics.Timer;
import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;
import edu.stanford.docstore.client.ClientMetrics;
import io.grpc.Channel;
import io.grpc.StatusRuntimeException;
import java.util.List;
import lombok.experimental.UtilityClass;
import lombok.extern.flogger.Flogger;

@Flogger
public class GrpcDatastoreApi implements DatastoreApi {
  private final DatastoreGrpc.DatastoreBlockingStub blockingStub;

  public GrpcDatastoreApi(Channel channel) {
    blockingStub = DatastoreGrpc.newBlockingStub(channel);
  }

  @UtilityClass
  public static final class Timers {
    Timer beginTransaction = ClientMetrics.registry.timer("docstore-client.beginTransaction");
    Timer commit = ClientMetrics.registry.timer("docstore-client.commit");
    Timer rollback = ClientMetrics.registry.timer("docstore-client.rollback");

    public static void recreateTimers(String prefix) {
      beginTransaction = ClientMetrics.registry.timer(prefix + ".docstore-client.beginTransaction");
      commit = ClientMetrics.registry.timer(prefix + ".docstore-client.commit");
      rollback = ClientMetrics.registry.timer(prefix + ".docstore-client.rollback");
    }
  }

  @Override
  public ByteString beginTransaction(String project) {
    var timer = Timers.beginTransaction.time();
    try {
      var request = BeginTransactionRequest.newBuilder().setProjectId(project).build();
      var response = blockingStub.beginTransaction(request);
      log.atFine().log("Began transaction %s in project %s", hex(response.getTransaction()), project);
      return response.getTransaction();
    } catch (StatusRuntimeException e) {
      log.atWarning().log("BeginTransaction in project %s failed: %s", project, e.getStatus());
      throw e;
    } finally {
      timer.stop();
    }
  }

  @Override
  public CommitResponse commit(
      String project, CommitRequest.Mode mode, List<Mutation> mutations, ByteString transaction) {
    var timer = Timers.commit.time();
    try {
      var builder =
          CommitRequest.newBuilder()
              .setProjectId(project)
              .setMode(mode)
              .addAllMutations(mutations);
      if (transaction != null) {
        builder.setTransaction(transaction);
      }
      var response = blockingStub.commit(builder.build());
      log.atFine().log(
          "Got %s commit response for %d mutations: %d results, %d index updates",
          mode,
          mutations.size(),
          response.getMutationResultsCount(),
          response.getIndexUpdates());
      return response;
    } catch (StatusRuntimeException e) {
      log.atWarning().log("%s commit in project %s failed: %s", mode, project, e.getStatus());
      throw e;
    } finally {
      timer.stop();
    }
  }

  @Override
  public void rollback(String project, ByteString transaction) {
    var timer = Timers.rollback.time();
    try {
      var request =
          RollbackRequest.newBuilder().setProjectId(project).setTransaction(transaction).build();
      blockingStub.rollback(request);
      log.atFine().log("Rolled back transaction %s in project %s", hex(transaction), project);
    } catch (StatusRuntimeException e) {
      log.atWarning().log(
          "Rollback of transaction %s in project %s failed: %s",
          hex(transaction), project, e.getStatus());
      throw e;
    } finally {
      timer.stop();
    }
  }

  static String hex(ByteString transaction) {
    return BaseEncoding.base16().lowerCase().encode(transaction.toByteArray());
  }
}
