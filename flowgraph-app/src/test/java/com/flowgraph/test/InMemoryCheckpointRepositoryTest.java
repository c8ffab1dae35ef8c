package com.flowgraph.test;

import com.flowgraph.domain.execution.model.entity.CheckpointEntity;
import com.flowgraph.domain.execution.model.valobj.ChatMessage;
import com.flowgraph.domain.execution.model.valobj.ExecutionState;
import com.flowgraph.domain.execution.model.valobj.StateUpdate;
import com.flowgraph.infrastructure.repository.checkpoint.InMemoryCheckpointRepository;
import com.flowgraph.test.support.EngineFixture;
import com.flowgraph.types.enums.ResponseCode;
import com.flowgraph.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

public class InMemoryCheckpointRepositoryTest {

    private final InMemoryCheckpointRepository repository = new InMemoryCheckpointRepository(EngineFixture.jsonCodec());

    private CheckpointEntity checkpoint(String threadId, int stepIndex, ExecutionState state, List<String> pending,
                                        boolean interrupted) {
        return CheckpointEntity.builder()
                .workflowId("wf")
                .threadId(threadId)
                .stepIndex(stepIndex)
                .sourceNodeId("n" + stepIndex)
                .state(state)
                .pendingNodes(pending)
                .interrupted(interrupted)
                .build();
    }

    @Test
    public void shouldStoreIndependentCopies() {
        ExecutionState state = ExecutionState.initial();
        Map<String, Object> namespace = new LinkedHashMap<>();
        namespace.put("text", "v1");
        state.getVariables().put("draft", namespace);
        state.getMessages().add(ChatMessage.human("hello"));

        CheckpointEntity saved = repository.append(checkpoint("t-1", 1, state, List.of("next"), false));
        namespace.put("text", "mutated");
        saved.getState().getMessages().clear();

        CheckpointEntity latest = repository.findLatest("wf", "t-1");
        Assertions.assertNotNull(latest.getCheckpointId());
        Assertions.assertNotNull(latest.getCreatedAt());
        Assertions.assertEquals("v1", latest.getState().resolveVariable("draft.text"));
        Assertions.assertEquals("hello", latest.getState().lastMessage().getContent());
        Assertions.assertEquals(List.of("next"), latest.getPendingNodes());

        latest.getState().getVariables().clear();
        Assertions.assertEquals("v1", repository.findLatest("wf", "t-1").getState().resolveVariable("draft.text"));
    }

    @Test
    public void shouldListHistoryNewestFirstWithLimit() {
        for (int step = 1; step <= 4; step++) {
            repository.append(checkpoint("t-2", step, ExecutionState.initial(), List.of(), false));
        }
        repository.append(checkpoint("other", 9, ExecutionState.initial(), List.of(), false));

        List<CheckpointEntity> history = repository.findHistory("wf", "t-2", 3);

        Assertions.assertEquals(List.of(4, 3, 2), history.stream().map(CheckpointEntity::getStepIndex).toList());
        Assertions.assertTrue(history.get(0).getSequence() > history.get(1).getSequence());
        Assertions.assertEquals(4, repository.findHistory("wf", "t-2", 0).size());
        Assertions.assertTrue(repository.findHistory("wf", "missing", 10).isEmpty());
        Assertions.assertNull(repository.findLatest("wf", "missing"));
    }

    @Test
    public void shouldInjectValueKeepingPendingNodes() {
        repository.append(checkpoint("t-3", 2, ExecutionState.initial(), List.of("gate"), true));

        CheckpointEntity injected = repository.injectValue("wf", "t-3",
                StateUpdate.builder().humanFeedback("ok").build());

        Assertions.assertEquals(2, injected.getStepIndex());
        Assertions.assertEquals(List.of("gate"), injected.getPendingNodes());
        Assertions.assertTrue(injected.isInterrupted());
        Assertions.assertEquals("ok", injected.getState().getHumanFeedback());
        Assertions.assertNull(injected.getSourceNodeId());
        Assertions.assertEquals(2, repository.findHistory("wf", "t-3", 0).size());
    }

    @Test
    public void shouldRejectInjectForUnknownThread() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> repository.injectValue("wf", "ghost", StateUpdate.empty()));

        Assertions.assertTrue(ex.is(ResponseCode.THREAD_NOT_FOUND));
    }

    @Test
    public void shouldValidateCheckpointKeys() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> repository.append(checkpoint(" ", 1, ExecutionState.initial(), List.of(), false)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> repository.append(checkpoint("t-4", 1, null, List.of(), false)));
    }

    @Test
    public void shouldNotBlockWritesOfOtherThreadsWhileOneThreadIsWriting() throws Exception {
        LockExposingRepository lockingRepository = new LockExposingRepository();
        Lock held = lockingRepository.writeLock("wf", "thread-0");
        Assertions.assertSame(held, lockingRepository.writeLock("wf", "thread-0"));

        ExecutorService writer = Executors.newSingleThreadExecutor();
        held.lock();
        try {
            for (int i = 1; i <= 200; i++) {
                String threadId = "thread-" + i;
                Future<CheckpointEntity> future = writer.submit(() -> lockingRepository.append(
                        checkpoint(threadId, 1, ExecutionState.initial(), List.of(), false)));
                CheckpointEntity saved = future.get(1, TimeUnit.SECONDS);
                Assertions.assertEquals(threadId, saved.getThreadId());
            }
            Future<CheckpointEntity> sameThread = writer.submit(() -> lockingRepository.append(
                    checkpoint("thread-0", 1, ExecutionState.initial(), List.of(), false)));
            Thread.sleep(100);
            Assertions.assertFalse(sameThread.isDone());
            held.unlock();
            Assertions.assertEquals("thread-0", sameThread.get(1, TimeUnit.SECONDS).getThreadId());
        } finally {
            writer.shutdownNow();
        }
    }

    private static final class LockExposingRepository extends InMemoryCheckpointRepository {

        private LockExposingRepository() {
            super(EngineFixture.jsonCodec());
        }

        private Lock writeLock(String workflowId, String threadId) {
            return lockFor(workflowId, threadId);
        }
    }
}
