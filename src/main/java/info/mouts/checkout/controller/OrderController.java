package info.mouts.checkout.controller;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.data.web.PagedResourcesAssembler;
import org.springframework.hateoas.CollectionModel;
import org.springframework.hateoas.EntityModel;
import org.springframework.hateoas.MediaTypes;
import org.springframework.hateoas.PagedModel;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderItem;
import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.domain.Requester;
import info.mouts.checkout.domain.Role;
import info.mouts.checkout.dto.CancelOrderRequestDTO;
import info.mouts.checkout.dto.OrderItemResponseDTO;
import info.mouts.checkout.dto.OrderResponseDTO;
import info.mouts.checkout.dto.OrderStatusResponseDTO;
import info.mouts.checkout.dto.OrdersSummaryDTO;
import info.mouts.checkout.mapper.OrderMapper;
import info.mouts.checkout.service.CheckoutService;
import info.mouts.checkout.service.OrderItemService;
import info.mouts.checkout.util.RequestHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.*;

/**
 * REST controller for retrieving and managing {@link Order} information.
 * Every endpoint acts on behalf of the user forwarded by the upstream gateway
 * in the {@code X-User-Id} and {@code X-User-Role} headers.
 * Uses HATEOAS to provide navigational links in responses.
 */
@RestController
@RequestMapping("/api/v1/orders")
@Tag(name = "Orders API", description = "Endpoints for retrieving, cancelling and refunding orders")
@Slf4j
public class OrderController {
    private final CheckoutService checkoutService;
    private final OrderItemService orderItemService;

    private final PagedResourcesAssembler<OrderResponseDTO> pagedResourcesAssembler;

    private final OrderMapper orderMapper;

    /**
     * Constructs an instance of {@code OrderController}.
     *
     * @param checkoutService         Service for access-checked order operations.
     * @param orderItemService        Service for order item-related operations.
     * @param orderMapper             Mapper for converting between entities and
     *                                DTOs.
     * @param pagedResourcesAssembler Assembler for creating HATEOAS PagedModel.
     */
    public OrderController(CheckoutService checkoutService, OrderItemService orderItemService,
            OrderMapper orderMapper, PagedResourcesAssembler<OrderResponseDTO> pagedResourcesAssembler) {
        this.checkoutService = checkoutService;
        this.orderItemService = orderItemService;
        this.orderMapper = orderMapper;
        this.pagedResourcesAssembler = pagedResourcesAssembler;
    }

    /**
     * <p>
     * Retrieves a paginated list of the caller's orders, newest first.
     * </p>
     *
     * @param userId   The caller, forwarded by the gateway.
     * @param pageable Pagination and sorting information (defaults to size 10,
     *                 sorted by createdAt descending).
     * @return A {@link ResponseEntity} containing a {@link PagedModel} of
     *         {@link OrderResponseDTO}s with HATEOAS links.
     */
    @GetMapping(produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get My Orders", description = "Retrieves a paginated list of the caller's orders.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Orders retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = PagedModel.class))),
            @ApiResponse(responseCode = "400", description = "Missing user header", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<PagedModel<EntityModel<OrderResponseDTO>>> findMyOrders(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @Parameter(hidden = true) @PageableDefault(size = 10, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable) {
        Page<Order> orders = checkoutService.listOrdersForUser(userId, pageable);

        return ResponseEntity.ok(toPagedModel(orders));
    }

    /**
     * <p>
     * Retrieves a paginated list of all orders. Administrators only.
     * </p>
     */
    @GetMapping(value = "/all", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get All Orders", description = "Retrieves a paginated list of all orders (administrators only).")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Orders retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = PagedModel.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not an administrator", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<PagedModel<EntityModel<OrderResponseDTO>>> findAllOrders(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(name = RequestHeaders.USER_ROLE, required = false) String role,
            @Parameter(hidden = true) @PageableDefault(size = 10, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable) {
        Page<Order> orders = checkoutService.listAllOrders(requester(userId, role), pageable);

        return ResponseEntity.ok(toPagedModel(orders));
    }

    /**
     * <p>
     * Summarizes the orders created in the last {@code days} days.
     * Administrators only.
     * </p>
     *
     * @param days Length of the period, 1 to 365 (defaults to 30).
     */
    @GetMapping("/summary")
    @Operation(summary = "Get Orders Summary", description = "Counts recent orders per status and sums the revenue of the paid ones (administrators only).")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Summary computed", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = OrdersSummaryDTO.class))),
            @ApiResponse(responseCode = "400", description = "Period outside 1 to 365 days", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not an administrator", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrdersSummaryDTO> getOrdersSummary(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(name = RequestHeaders.USER_ROLE, required = false) String role,
            @RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(checkoutService.getOrdersSummary(requester(userId, role), days));
    }

    /**
     * <p>
     * Retrieves an order by its order number, as printed on receipts.
     * </p>
     */
    @GetMapping(value = "/number/{orderNumber}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get an Order by Number", description = "Retrieves an order by its human-readable order number.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "403", description = "Caller neither owns the order nor is an administrator", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "No order carries the number", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> findByOrderNumber(@PathVariable String orderNumber,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(name = RequestHeaders.USER_ROLE, required = false) String role) {
        Order order = checkoutService.getOrderByNumber(orderNumber, requester(userId, role));

        return ResponseEntity.ok(withLinks(orderMapper.toOrderResponseDto(order)));
    }

    /**
     * <p>
     * Retrieves an order by its unique ID.
     * </p>
     *
     * @param orderId The UUID of the order to retrieve.
     * @return A {@link ResponseEntity} containing the {@link OrderResponseDTO} with
     *         HATEOAS links (self, status, items).
     */
    @GetMapping(value = "/{orderId}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get an Order by ID", description = "Retrieves an order by its unique ID.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid UUID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Caller neither owns the order nor is an administrator", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> findByOrderId(@PathVariable UUID orderId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(name = RequestHeaders.USER_ROLE, required = false) String role) {
        Order order = checkoutService.getOrder(orderId, requester(userId, role));

        return ResponseEntity.ok(withLinks(orderMapper.toOrderResponseDto(order)));
    }

    @GetMapping(value = "/{orderId}/status")
    @Operation(summary = "Get an Order's Status", description = "Retrieves the current status of an order.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status retrieved successfully", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = OrderStatusResponseDTO.class))),
            @ApiResponse(responseCode = "403", description = "Caller neither owns the order nor is an administrator", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderStatusResponseDTO> findOrderStatus(@PathVariable UUID orderId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(name = RequestHeaders.USER_ROLE, required = false) String role) {
        OrderStatus status = checkoutService.getOrderStatus(orderId, requester(userId, role));

        return ResponseEntity.ok(new OrderStatusResponseDTO(orderId, status));
    }

    /**
     * <p>
     * Retrieves the list of items associated with a specific order.
     * </p>
     *
     * @param orderId The UUID of the order whose items are to be retrieved.
     * @return A {@link ResponseEntity} containing a {@link CollectionModel} of
     *         {@link OrderItemResponseDTO}s with HATEOAS links.
     */
    @GetMapping(value = "/{orderId}/items", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get Items for an Order", description = "Retrieves the list of items associated with a specific order.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Items retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = CollectionModel.class))),
            @ApiResponse(responseCode = "403", description = "Caller neither owns the order nor is an administrator", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CollectionModel<OrderItemResponseDTO>> findOrderItems(@PathVariable UUID orderId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(name = RequestHeaders.USER_ROLE, required = false) String role) {
        checkoutService.getOrder(orderId, requester(userId, role));
        List<OrderItem> orderItems = orderItemService.findOrderItemsByOrderId(orderId);

        List<OrderItemResponseDTO> responseDTOs = orderMapper.toOrderItemResponseDtoList(orderItems);
        CollectionModel<OrderItemResponseDTO> collectionModel = CollectionModel.of(responseDTOs);

        collectionModel.add(linkTo(methodOn(OrderController.class).findOrderItems(orderId, userId, role)).withSelfRel());
        collectionModel.add(linkTo(methodOn(OrderController.class).findByOrderId(orderId, userId, role)).withRel("order"));

        return ResponseEntity.ok(collectionModel);
    }

    @PostMapping(value = "/{orderId}/cancel", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Cancel an Order", description = "Cancels an order that has not entered payment yet. Owner or administrator.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order cancelled", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "403", description = "Caller neither owns the order nor is an administrator", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Order is no longer pending", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> cancelOrder(@PathVariable UUID orderId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(name = RequestHeaders.USER_ROLE, required = false) String role,
            @Valid @RequestBody(required = false) CancelOrderRequestDTO request) {
        String reason = request == null ? null : request.getReason();
        Order order = checkoutService.cancelOrder(orderId, requester(userId, role), reason);

        return ResponseEntity.ok(withLinks(orderMapper.toOrderResponseDto(order)));
    }

    @PostMapping(value = "/{orderId}/refund", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Refund an Order", description = "Refunds a paid order in full (administrators only).")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order refunded", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "403", description = "Caller is not an administrator", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Order is not paid", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Payment processor error", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<OrderResponseDTO> refundOrder(@PathVariable UUID orderId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(name = RequestHeaders.USER_ROLE, required = false) String role) {
        Order order = checkoutService.refundOrder(orderId, requester(userId, role));

        return ResponseEntity.ok(withLinks(orderMapper.toOrderResponseDto(order)));
    }

    private PagedModel<EntityModel<OrderResponseDTO>> toPagedModel(Page<Order> orders) {
        Page<OrderResponseDTO> orderResponseDTOs = orders.map(orderMapper::toOrderResponseDto);
        orderResponseDTOs.forEach(dto -> dto.add(
                linkTo(methodOn(OrderController.class).findByOrderId(dto.getId(), null, null)).withSelfRel()));

        return pagedResourcesAssembler.toModel(orderResponseDTOs);
    }

    private OrderResponseDTO withLinks(OrderResponseDTO dto) {
        UUID orderId = dto.getId();
        dto.add(linkTo(methodOn(OrderController.class).findByOrderId(orderId, null, null)).withSelfRel());
        dto.add(linkTo(methodOn(OrderController.class).findOrderStatus(orderId, null, null)).withRel("status"));
        dto.add(linkTo(methodOn(OrderController.class).findOrderItems(orderId, null, null)).withRel("items"));
        return dto;
    }

    static Requester requester(String userId, String role) {
        return new Requester(userId, Role.fromHeader(role));
    }
}
