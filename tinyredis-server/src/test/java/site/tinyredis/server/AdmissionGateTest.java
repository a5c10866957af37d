package site.tinyredis.server;

import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("准入闸门测试")
class AdmissionGateTest {

    private static Future<AdmissionGate.Permit> acquire(final AdmissionGate gate) {
        return gate.acquire(ImmediateEventExecutor.INSTANCE);
    }

    @Test
    @DisplayName("许可用完后的申请等待，归还一个许可只放行一个")
    void testBlocksAtLimit() {
        final AdmissionGate gate = new AdmissionGate(2);
        final Future<AdmissionGate.Permit> first = acquire(gate);
        final Future<AdmissionGate.Permit> second = acquire(gate);
        final Future<AdmissionGate.Permit> third = acquire(gate);
        final Future<AdmissionGate.Permit> fourth = acquire(gate);

        assertThat(first.isSuccess()).isTrue();
        assertThat(second.isSuccess()).isTrue();
        assertThat(third.isDone()).isFalse();
        assertThat(fourth.isDone()).isFalse();
        assertThat(gate.waiting()).isEqualTo(2);

        first.getNow().close();

        assertThat(third.isSuccess()).isTrue();
        assertThat(fourth.isDone()).isFalse();
        assertThat(gate.availablePermits()).isZero();
    }

    @Test
    @DisplayName("重复关闭许可只归还一次")
    void testPermitReleasedOnce() {
        final AdmissionGate gate = new AdmissionGate(1);
        final AdmissionGate.Permit permit = acquire(gate).getNow();

        permit.close();
        permit.close();

        assertThat(permit.isReleased()).isTrue();
        assertThat(gate.availablePermits()).isEqualTo(1);
    }

    @Test
    @DisplayName("取消的申请不占用归还的许可")
    void testCancelledWaiterSkipped() {
        final AdmissionGate gate = new AdmissionGate(1);
        final AdmissionGate.Permit held = acquire(gate).getNow();
        final Future<AdmissionGate.Permit> cancelled = acquire(gate);
        final Future<AdmissionGate.Permit> waiting = acquire(gate);

        assertThat(cancelled.cancel(false)).isTrue();
        held.close();

        assertThat(waiting.isSuccess()).isTrue();
        waiting.getNow().close();
        assertThat(gate.availablePermits()).isEqualTo(1);
    }

    @Test
    @DisplayName("许可数必须为正")
    void testInvalidPermits() {
        assertThatThrownBy(() -> new AdmissionGate(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
