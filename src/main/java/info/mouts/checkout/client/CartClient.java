package info.mouts.checkout.client;

import java.util.List;

import info.mouts.checkout.dto.CartItemDTO;
import info.mouts.checkout.exception.CollaboratorUnavailableException;

/**
 * Read access to the users' carts.
 */
public interface CartClient {
    /**
     * Returns the items currently in the user's cart.
     *
     * @param userId The cart owner.
     * @return The cart items, empty when the user has no cart.
     * @throws CollaboratorUnavailableException If the cart service cannot answer.
     */
    List<CartItemDTO> getCart(String userId);
}
