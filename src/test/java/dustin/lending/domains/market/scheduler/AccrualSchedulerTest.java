package dustin.lending.domains.market.scheduler;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;

import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.market.repository.MarketRepository;
import dustin.lending.domains.market.service.InterestAccrualService;

/**
 * 이자 누적 스케줄러 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class AccrualSchedulerTest {

    @Mock
    private MarketRepository marketRepository;

    @Mock
    private InterestAccrualService interestAccrualService;

    @InjectMocks
    private AccrualScheduler accrualScheduler;

    @Test
    @DisplayName("한 마켓의 누적이 실패해도 나머지 마켓은 계속 누적한다")
    void continuesAfterMarketFailure() {
        when(marketRepository.findByActiveTrueOrderByAssetAsc()).thenReturn(List.of(
                Market.builder().asset("DAI").build(),
                Market.builder().asset("ETH").build(),
                Market.builder().asset("USDC").build()));
        when(interestAccrualService.accrueMarket("ETH"))
                .thenThrow(new PessimisticLockingFailureException("lock timeout"));

        accrualScheduler.accrueActiveMarkets();

        InOrder order = inOrder(interestAccrualService);
        order.verify(interestAccrualService).accrueMarket("DAI");
        order.verify(interestAccrualService).accrueMarket("ETH");
        order.verify(interestAccrualService).accrueMarket("USDC");
    }
}
