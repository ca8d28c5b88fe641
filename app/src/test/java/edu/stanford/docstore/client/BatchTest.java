package edu.stanford.docstore.client;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import edu.stanford.docstore.CommitRequest;
import edu.stanford.docstore.DatastoreClient;
import edu.stanford.docstore.Entity;
import edu.stanford.docstore.FakeDatastoreApi;
import edu.stanford.docstore.Key;
import edu.stanford.docstore.PathElement;
import edu.stanford.docstore.ProtoUtils;
import java.io.IOException;
import org.junit.jupiter.api.Test;

public class BatchTest {
  static final String PROJECT = "PROJECT";

  FakeDatastoreApi api = new FakeDatastoreApi();
  DatastoreClient client = new DatastoreClient(PROJECT, "ns", api);

  @Test
  void testDefaults() {
    var batch = client.batch();
    assertThat(batch.getProject()).isEqualTo(PROJECT);
    assertThat(batch.getNamespace()).isEqualTo("ns");
    assertThat(batch.getStatus()).isEqualTo(Batch.Status.INITIAL);
    assertThat(batch.getMutations()).isEmpty();
    assertThat(batch.kind()).isEqualTo(Batch.Kind.BATCH);
    assertThat(batch.current()).isNull();
  }

  @Test
  void testPutAndDelete_keepStagingOrder() {
    var first = new Entity(client.key(PathElement.of("Kind", 1)));
    first.set("name", "first");
    var deleted = client.key(PathElement.of("Kind", 2));
    var second = new Entity(client.key(PathElement.of("Kind")));

    var batch = client.batch();
    batch.put(first);
    batch.delete(deleted);
    batch.put(second);

    var mutations = batch.getMutations();
    assertThat(mutations).hasSize(3);
    assertThat(mutations.get(0).getUpsert()).isEqualTo(ProtoUtils.toProto(first));
    assertThat(mutations.get(1).getDelete()).isEqualTo(ProtoUtils.toProto(deleted));
    assertThat(mutations.get(2).getUpsert()).isEqualTo(ProtoUtils.toProto(second));
  }

  @Test
  void testPut_usesPropertiesAtStagingTime() {
    var entity = new Entity(client.key(PathElement.of("Kind", 1)));
    entity.set("count", 1);
    var batch = client.batch();
    batch.put(entity);
    entity.set("count", 2);

    var upsert = batch.getMutations().get(0).getUpsert();
    assertThat(upsert.getPropertiesOrThrow("count").getIntegerValue()).isEqualTo(1L);
  }

  @Test
  void testPut_validation() {
    var batch = client.batch();
    assertThrows(IllegalArgumentException.class, () -> batch.put(null));
    assertThrows(IllegalArgumentException.class, () -> batch.put(new Entity(null)));
    var foreign = new Entity(Key.of("OTHER", "ns", PathElement.of("Kind", 1)));
    var e = assertThrows(IllegalArgumentException.class, () -> batch.put(foreign));
    assertThat(e).hasMessageThat().contains("OTHER");
    assertThat(batch.getMutations()).isEmpty();
  }

  @Test
  void testDelete_validation() {
    var batch = client.batch();
    assertThrows(IllegalArgumentException.class, () -> batch.delete(null));
    var partial = client.key(PathElement.of("Kind"));
    var e = assertThrows(IllegalArgumentException.class, () -> batch.delete(partial));
    assertThat(e).hasMessageThat().contains("complete");
    assertThrows(
        IllegalArgumentException.class,
        () -> batch.delete(Key.of("OTHER", null, PathElement.of("Kind", 1))));
    assertThat(batch.getMutations()).isEmpty();
  }

  @Test
  void testBegin_onlyOnce() {
    var batch = client.batch();
    batch.begin();
    assertThat(batch.getStatus()).isEqualTo(Batch.Status.IN_PROGRESS);
    assertThrows(IllegalStateException.class, batch::begin);
  }

  @Test
  void testCommit_nonTransactional() {
    var batch = client.batch();
    batch.begin();
    batch.put(new Entity(client.key(PathElement.of("Kind", 1))));
    var staged = batch.getMutations();
    batch.commit();

    assertThat(api.beginCalls).isEmpty();
    assertThat(api.commitCalls)
        .containsExactly(
            new FakeDatastoreApi.CommitCall(
                PROJECT, CommitRequest.Mode.NON_TRANSACTIONAL, staged, null));
    assertThat(batch.getStatus()).isEqualTo(Batch.Status.COMMITTED);
    assertThat(batch.getMutations()).isEmpty();
  }

  @Test
  void testCommit_requiresInProgress() {
    var batch = client.batch();
    assertThrows(IllegalStateException.class, batch::commit);
    batch.begin();
    batch.commit();
    assertThrows(IllegalStateException.class, batch::commit);
    assertThat(api.commitCalls).hasSize(1);
  }

  @Test
  void testCommit_failureLeavesBatchRetryable() {
    api.commitFailure = new RuntimeException("unavailable");
    var batch = client.batch();
    batch.begin();
    batch.put(new Entity(client.key(PathElement.of("Kind", 1))));

    assertThrows(RuntimeException.class, batch::commit);
    assertThat(batch.getStatus()).isEqualTo(Batch.Status.IN_PROGRESS);
    assertThat(batch.getMutations()).hasSize(1);

    api.commitFailure = null;
    batch.commit();
    assertThat(api.commitCalls).hasSize(2);
    assertThat(api.commitCalls.get(1).mutations()).hasSize(1);
    assertThat(batch.getStatus()).isEqualTo(Batch.Status.COMMITTED);
  }

  @Test
  void testRollback_isLocal() {
    var batch = client.batch();
    batch.begin();
    batch.put(new Entity(client.key(PathElement.of("Kind", 1))));
    batch.rollback();

    assertThat(batch.getStatus()).isEqualTo(Batch.Status.ABORTED);
    assertThat(batch.getMutations()).isEmpty();
    assertThat(api.rollbackCalls).isEmpty();
    assertThat(api.commitCalls).isEmpty();
  }

  @Test
  void testStaging_afterFinishFails() {
    var batch = client.batch();
    batch.begin();
    batch.rollback();
    var entity = new Entity(client.key(PathElement.of("Kind", 1)));
    assertThrows(IllegalStateException.class, () -> batch.put(entity));
    assertThrows(IllegalStateException.class, () -> batch.delete(entity.getKey()));
  }

  @Test
  void testScoped_commitsOnNormalExit() {
    var batch = client.batch();
    batch.run(
        () -> {
          assertThat(client.getCurrentBatch()).isSameInstanceAs(batch);
          assertThat(client.getCurrentTransaction()).isNull();
          client.put(new Entity(client.key(PathElement.of("Kind", 1))));
          client.delete(client.key(PathElement.of("Kind", 2)));
          // staged into the batch, nothing sent yet
          assertThat(api.commitCalls).isEmpty();
        });

    assertThat(api.commitCalls).hasSize(1);
    assertThat(api.commitCalls.get(0).mode()).isEqualTo(CommitRequest.Mode.NON_TRANSACTIONAL);
    assertThat(api.commitCalls.get(0).mutations()).hasSize(2);
    assertThat(batch.getStatus()).isEqualTo(Batch.Status.COMMITTED);
    assertThat(client.getCurrentBatch()).isNull();
  }

  @Test
  void testScoped_errorDiscardsWithoutCommit() {
    var batch = client.batch();
    var thrown =
        assertThrows(
            IOException.class,
            () ->
                batch.run(
                    () -> {
                      batch.put(new Entity(client.key(PathElement.of("Kind", 1))));
                      throw new IOException("disk full");
                    }));

    assertThat(thrown).hasMessageThat().isEqualTo("disk full");
    assertThat(api.commitCalls).isEmpty();
    assertThat(api.rollbackCalls).isEmpty();
    assertThat(batch.getStatus()).isEqualTo(Batch.Status.ABORTED);
    assertThat(client.getCurrentBatch()).isNull();
  }

  @Test
  void testScoped_nestedUnitsRestorePreviousTop() {
    var outer = client.batch();
    var txn = client.transaction();
    var inner = client.batch();

    outer.run(
        () -> {
          txn.run(
              () -> {
                assertThat(client.getCurrentTransaction()).isSameInstanceAs(txn);
                inner.run(
                    () -> {
                      assertThat(client.getCurrentBatch()).isSameInstanceAs(inner);
                      assertThat(client.getCurrentTransaction()).isNull();
                      assertThat(txn.current()).isNull();
                      assertThat(client.getStack().size()).isEqualTo(3);
                    });
                assertThat(client.getCurrentBatch()).isSameInstanceAs(txn);
              });
          assertThat(client.getCurrentBatch()).isSameInstanceAs(outer);
        });

    assertThat(client.getStack().size()).isEqualTo(0);
    assertThat(api.beginCalls).hasSize(1);
    assertThat(api.commitCalls).hasSize(3);
    assertThat(api.commitCalls.get(0).mode()).isEqualTo(CommitRequest.Mode.NON_TRANSACTIONAL);
    assertThat(api.commitCalls.get(1).mode()).isEqualTo(CommitRequest.Mode.TRANSACTIONAL);
    assertThat(api.commitCalls.get(2).mode()).isEqualTo(CommitRequest.Mode.NON_TRANSACTIONAL);
  }
}
