package me.golemcore.agent.adapter.outbound.llm;

import me.golemcore.agent.domain.model.ModelChunk;
import me.golemcore.agent.domain.model.ModelMessage;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class NoOpConversationAdapterTest {

    @Test
    void shouldReplyWithSingleTextChunk() {
        StepVerifier.create(new NoOpConversationAdapter().sendMessageStream(ModelMessage.ofText("hi")))
                .assertNext(chunk -> {
                    assertEquals(NoOpConversationAdapter.REPLY, chunk.getText());
                    assertFalse(chunk.hasFunctionCalls());
                })
                .verifyComplete();
    }
}
