package com.ryuqq.courier.adapter.inmemory.bus;

import com.ryuqq.courier.core.contract.Envelope;
import com.ryuqq.courier.core.model.TargetId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MessageQueue 테스트.
 *
 * @author Courier Team
 * @since 1.0.0
 */
class MessageQueueTest {

    @Test
    void 와일드카드_요청은_삽입_순서대로_꺼낸다() {
        // given
        MessageQueue<String> queue = new MessageQueue<>();
        queue.add(Envelope.of("a", TargetId.of(1)));
        queue.add(Envelope.of("b"));
        queue.add(Envelope.of("c", TargetId.of(2)));

        // when & then
        assertThat(queue.poll(TargetId.ANY).payload()).isEqualTo("a");
        assertThat(queue.poll(TargetId.ANY).payload()).isEqualTo("b");
        assertThat(queue.poll(TargetId.ANY).payload()).isEqualTo("c");
        assertThat(queue.poll(TargetId.ANY)).isNull();
    }

    @Test
    void 대상_지정_요청은_가장_먼저_삽입된_일치_항목을_꺼낸다() {
        // given
        MessageQueue<String> queue = new MessageQueue<>();
        queue.add(Envelope.of("for-1", TargetId.of(1)));
        queue.add(Envelope.of("for-2-first", TargetId.of(2)));
        queue.add(Envelope.of("any"));
        queue.add(Envelope.of("for-2-second", TargetId.of(2)));

        // when & then
        assertThat(queue.poll(TargetId.of(2)).payload()).isEqualTo("for-2-first");
        assertThat(queue.poll(TargetId.of(2)).payload()).isEqualTo("any");
        assertThat(queue.poll(TargetId.of(2)).payload()).isEqualTo("for-2-second");
        assertThat(queue.poll(TargetId.of(2))).isNull();
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void 일치_항목이_없으면_큐를_변경하지_않는다() {
        // given
        MessageQueue<String> queue = new MessageQueue<>();
        queue.add(Envelope.of("for-1", TargetId.of(1)));

        // when
        Envelope<String> polled = queue.poll(TargetId.of(3));

        // then
        assertThat(polled).isNull();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.isEmpty()).isFalse();
    }

    @Test
    void clear는_버린_항목_수를_반환한다() {
        // given
        MessageQueue<Integer> queue = new MessageQueue<>();
        queue.add(Envelope.of(1));
        queue.add(Envelope.of(2));

        // when
        int dropped = queue.clear();

        // then
        assertThat(dropped).isEqualTo(2);
        assertThat(queue.isEmpty()).isTrue();
    }
}
