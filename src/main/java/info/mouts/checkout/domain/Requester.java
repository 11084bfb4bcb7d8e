package info.mouts.checkout.domain;

/**
 * Authenticated caller of an order operation, as forwarded by the upstream
 * gateway.
 *
 * @param userId The caller's user id.
 * @param role   The caller's role.
 */
public record Requester(String userId, Role role) {

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean owns(Order order) {
        return order != null && userId != null && userId.equals(order.getUserId());
    }

    public boolean canAccess(Order order) {
        return isAdmin() || owns(order);
    }
}
