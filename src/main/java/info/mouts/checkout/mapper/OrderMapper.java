package info.mouts.checkout.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Mappings;

import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderItem;
import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.dto.CartItemDTO;
import info.mouts.checkout.dto.OrderItemRequestDTO;
import info.mouts.checkout.dto.OrderItemResponseDTO;
import info.mouts.checkout.dto.OrderResponseDTO;
import info.mouts.checkout.dto.OrderStatusChangedEventDTO;

/**
 * Mapper interface for converting between order entities and their DTOs using
 * MapStruct.
 */
@Mapper(componentModel = "spring")
public interface OrderMapper {

    /**
     * Maps a cart item to an order line request. The cart's price, if any, is
     * never carried over.
     *
     * @param dto The source {@link CartItemDTO}.
     * @return The mapped {@link OrderItemRequestDTO}.
     */
    OrderItemRequestDTO toOrderItemRequestDto(CartItemDTO dto);

    List<OrderItemRequestDTO> toOrderItemRequestDtoList(List<CartItemDTO> dtoList);

    /**
     * Maps an {@link Order} entity to an {@link OrderResponseDTO}.
     *
     * @param entity The source {@link Order} entity.
     * @return The mapped {@link OrderResponseDTO}.
     */
    OrderResponseDTO toOrderResponseDto(Order entity);

    /**
     * Maps an {@link OrderItem} entity to an {@link OrderItemResponseDTO},
     * including the computed line total.
     *
     * @param entity The source {@link OrderItem} entity.
     * @return The mapped {@link OrderItemResponseDTO}.
     */
    OrderItemResponseDTO toOrderItemResponseDto(OrderItem entity);

    List<OrderItemResponseDTO> toOrderItemResponseDtoList(List<OrderItem> entityList);

    /**
     * Maps an {@link Order} entity to the payload published after a status
     * change.
     *
     * @param order          The order after the change.
     * @param previousStatus The status before the change, {@code null} for a new
     *                       order.
     * @return The mapped {@link OrderStatusChangedEventDTO}.
     */
    @Mappings({
            @Mapping(source = "order.id", target = "orderId"),
            @Mapping(source = "order.orderNumber", target = "orderNumber"),
            @Mapping(source = "order.userId", target = "userId"),
            @Mapping(source = "previousStatus", target = "previousStatus"),
            @Mapping(source = "order.status", target = "status"),
            @Mapping(source = "order.totalAmount", target = "totalAmount"),
            @Mapping(source = "order.currency", target = "currency"),
            @Mapping(source = "order.paymentIntentId", target = "paymentIntentId"),
            @Mapping(source = "order.updatedAt", target = "changedAt")
    })
    OrderStatusChangedEventDTO toStatusChangedEventDto(Order order, OrderStatus previousStatus);
}
