package info.mouts.checkout.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

public class RequesterTest {
    private final Order order = Order.builder().userId("user-1").build();

    @Test
    void ownerCanAccess() {
        assertThat(new Requester("user-1", Role.USER).canAccess(order)).isTrue();
    }

    @Test
    void otherUserCannotAccess() {
        assertThat(new Requester("user-2", Role.USER).canAccess(order)).isFalse();
    }

    @Test
    void adminCanAccessAnyOrder() {
        assertThat(new Requester("admin-1", Role.ADMIN).canAccess(order)).isTrue();
    }

    @Test
    void roleHeaderFallsBackToUser() {
        assertThat(Role.fromHeader(null)).isEqualTo(Role.USER);
        assertThat(Role.fromHeader("superuser")).isEqualTo(Role.USER);
        assertThat(Role.fromHeader(" admin ")).isEqualTo(Role.ADMIN);
    }
}
