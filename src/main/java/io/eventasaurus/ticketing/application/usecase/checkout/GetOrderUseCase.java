package io.eventasaurus.ticketing.application.usecase.checkout;

import io.eventasaurus.ticketing.application.checkout.dto.OrderDetailResponse;
import io.eventasaurus.ticketing.application.usecase.UseCase;
import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.domain.order.Order;
import io.eventasaurus.ticketing.domain.order.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

/**
 * 주문 조회 UseCase (소유자 전용, 읽기 전용)
 */
@UseCase
@RequiredArgsConstructor
public class GetOrderUseCase {

    private final OrderRepository orderRepository;

    @Transactional(readOnly = true)
    public OrderDetailResponse execute(Long orderId, Long userId) {
        Order order = orderRepository.findByIdOrThrow(orderId);
        if (!order.isOwnedBy(userId)) {
            throw new BusinessException(ErrorCode.ORDER_ACCESS_DENIED);
        }
        return OrderDetailResponse.from(order);
    }
}
