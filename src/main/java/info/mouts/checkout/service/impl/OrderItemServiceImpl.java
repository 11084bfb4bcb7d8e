package info.mouts.checkout.service.impl;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.checkout.domain.OrderItem;
import info.mouts.checkout.repository.OrderItemRepository;
import info.mouts.checkout.service.OrderItemService;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderItemService} interface.
 */
@Service
@Slf4j
public class OrderItemServiceImpl implements OrderItemService {

    private final OrderItemRepository orderItemRepository;

    public OrderItemServiceImpl(OrderItemRepository orderItemRepository) {
        this.orderItemRepository = orderItemRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderItem> findOrderItemsByOrderId(UUID orderId) {
        log.debug("Attempting to find order items for the order with ID: {}", orderId);

        return orderItemRepository.findByOrder_Id(orderId);
    }
}
