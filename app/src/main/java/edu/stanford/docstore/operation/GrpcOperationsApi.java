package edu.stanford.docstore.operation;

import com.codahale.metrics.Timer;
import edu.stanford.docstore.client.ClientMetrics;
import io.grpc.Channel;
import io.grpc.StatusRuntimeException;
import lombok.experimental.UtilityClass;
import lombok.extern.flogger.Flogger;

@Flogger
public class GrpcOperationsApi implements OperationsApi {
  private final OperationsGrpc.OperationsBlockingStub blockingStub;

  public GrpcOperationsApi(Channel channel) {
    blockingStub = OperationsGrpc.newBlockingStub(channel);
  }

  @UtilityClass
  public static final class Timers {
    Timer getOperation = ClientMetrics.registry.timer("docstore-client.getOperation");
  }

  @Override
  public ProtoOperation getOperation(String name) {
    var timer = Timers.getOperation.time();
    try {
      var request = GetOperationRequest.newBuilder().setName(name).build();
      var response = blockingStub.getOperation(request);
      log.atFine().log("Operation %s done=%s", name, response.getDone());
      return response;
    } catch (StatusRuntimeException e) {
      log.atWarning().log("GetOperation %s failed: %s", name, e.getStatus());
      throw e;
    } finally {
      timer.stop();
    }
  }
}
