package dustin.lending.domains.position.service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.market.service.InterestAccrualService;
import dustin.lending.domains.position.model.entity.UserPosition;
import dustin.lending.domains.protocol.service.ProtocolStatusService;
import dustin.lending.domains.solvency.service.SolvencyEvaluator;
import dustin.lending.domains.wallet.service.AssetTransferGateway;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import dustin.lending.shared.kafka.model.LedgerEvent;
import dustin.lending.shared.kafka.model.LedgerEventType;
import dustin.lending.shared.math.WadMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 대출 서비스 (공급 / 출금 / 차입 / 상환 / 담보 설정)
 * Lending Service
 *
 * 처리 순서 (모든 작업 공통):
 * ==========================
 * 1. 일시 정지 확인
 * 2. 원장 계정 락 (사용자별 직렬화)
 * 3. 마켓 락 + 이자 누적
 * 4. 포지션 락 + 잔고 재구성
 * 5. 지급능력 검증
 * 6. 사용자 → custody 이체 (pull) 는 상태 변경 전, custody → 사용자 이체 (push) 는 상태 변경 후
 *
 * 전 과정이 하나의 트랜잭션이며 어느 단계에서든 실패하면 전부 롤백됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LendingService {

    private final ProtocolStatusService protocolStatusService;
    private final AccountLockService accountLockService;
    private final InterestAccrualService interestAccrualService;
    private final PositionAccounting positionAccounting;
    private final SolvencyEvaluator solvencyEvaluator;
    private final AssetTransferGateway assetTransferGateway;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * 공급
     * Supply
     *
     * 담보 사용 여부는 바꾸지 않습니다 (setCollateral로 별도 설정).
     *
     * @return 공급 후 포지션
     */
    @Transactional
    public UserPosition supply(Long userId, String asset, BigInteger amount) {
        requirePositive(amount);
        protocolStatusService.assertNotPaused();
        accountLockService.lock(userId);

        Market market = requireActive(interestAccrualService.lockAndAccrue(asset));
        UserPosition position = positionAccounting.lockOrCreate(userId, market);
        positionAccounting.reconcileSupply(position, market);

        assetTransferGateway.pull(asset, userId, amount);

        position.setSuppliedAmount(position.getSuppliedAmount().add(amount));
        market.setTotalSupplied(market.getTotalSupplied().add(amount));

        log.info("[LendingService] 공급 완료: userId={}, asset={}, amount={}, supplied={}",
                userId, asset, amount, position.getSuppliedAmount());
        publish(LedgerEventType.SUPPLIED, userId, asset, amount);
        return position;
    }

    /**
     * 출금
     * Withdraw
     *
     * 담보로 사용 중인 자산이면 출금 후에도 부채를 감당할 수 있어야 합니다.
     *
     * @return 출금 후 포지션
     */
    @Transactional
    public UserPosition withdraw(Long userId, String asset, BigInteger amount) {
        requirePositive(amount);
        protocolStatusService.assertNotPaused();
        accountLockService.lock(userId);

        Market market = interestAccrualService.lockAndAccrue(asset);
        UserPosition position = positionAccounting.lockExisting(userId, asset, LedgerErrorCode.INSUFFICIENT_BALANCE);
        positionAccounting.reconcileSupply(position, market);

        if (position.getSuppliedAmount().compareTo(amount) < 0) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_BALANCE,
                    "supplied " + position.getSuppliedAmount() + " < " + amount);
        }
        if (position.isCollateralEnabled()
                && !solvencyEvaluator.remainsSolventAfterWithdraw(userId, asset, amount)) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_COLLATERAL);
        }

        position.setSuppliedAmount(position.getSuppliedAmount().subtract(amount));
        market.setTotalSupplied(WadMath.saturatingSubtract(market.getTotalSupplied(), amount));

        assetTransferGateway.push(asset, userId, amount);

        log.info("[LendingService] 출금 완료: userId={}, asset={}, amount={}, supplied={}",
                userId, asset, amount, position.getSuppliedAmount());
        publish(LedgerEventType.WITHDRAWN, userId, asset, amount);
        return position;
    }

    /**
     * 차입
     * Borrow
     *
     * collateralValue >= borrowValue + amount × price 이어야 합니다.
     *
     * @return 차입 후 포지션
     */
    @Transactional
    public UserPosition borrow(Long userId, String asset, BigInteger amount) {
        requirePositive(amount);
        protocolStatusService.assertNotPaused();
        accountLockService.lock(userId);

        Market market = requireActive(interestAccrualService.lockAndAccrue(asset));
        if (!solvencyEvaluator.canBorrow(userId, asset, amount)) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_COLLATERAL);
        }

        UserPosition position = positionAccounting.lockOrCreate(userId, market);
        positionAccounting.reconcileBorrow(position, market);

        position.setBorrowedAmount(position.getBorrowedAmount().add(amount));
        market.setTotalBorrowed(market.getTotalBorrowed().add(amount));

        assetTransferGateway.push(asset, userId, amount);

        log.info("[LendingService] 차입 완료: userId={}, asset={}, amount={}, borrowed={}",
                userId, asset, amount, position.getBorrowedAmount());
        publish(LedgerEventType.BORROWED, userId, asset, amount);
        return position;
    }

    /**
     * 상환
     * Repay
     *
     * 부채보다 많이 요청하면 부채만큼만 상환합니다.
     *
     * @return 실제 상환 수량
     */
    @Transactional
    public BigInteger repay(Long userId, String asset, BigInteger amount) {
        requirePositive(amount);
        protocolStatusService.assertNotPaused();
        accountLockService.lock(userId);

        Market market = interestAccrualService.lockAndAccrue(asset);
        UserPosition position = positionAccounting.lockExisting(userId, asset, LedgerErrorCode.NO_COLLATERAL_OR_NO_DEBT);
        positionAccounting.reconcileBorrow(position, market);

        if (position.getBorrowedAmount().signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.NO_COLLATERAL_OR_NO_DEBT, "no debt: asset=" + asset);
        }
        BigInteger actualRepay = amount.min(position.getBorrowedAmount());

        assetTransferGateway.pull(asset, userId, actualRepay);

        position.setBorrowedAmount(position.getBorrowedAmount().subtract(actualRepay));
        market.setTotalBorrowed(WadMath.saturatingSubtract(market.getTotalBorrowed(), actualRepay));

        log.info("[LendingService] 상환 완료: userId={}, asset={}, requested={}, repaid={}, remaining={}",
                userId, asset, amount, actualRepay, position.getBorrowedAmount());
        publish(LedgerEventType.REPAID, userId, asset, actualRepay);
        return actualRepay;
    }

    /**
     * 담보 사용 설정
     * Enable or disable an asset as collateral
     *
     * - 활성화: 공급 잔고가 있어야 함
     * - 비활성화: 해당 자산 없이도 부채를 감당할 수 있어야 함
     *
     * @return 변경 후 포지션
     */
    @Transactional
    public UserPosition setCollateral(Long userId, String asset, boolean enabled) {
        protocolStatusService.assertNotPaused();
        accountLockService.lock(userId);

        Market market = interestAccrualService.lockAndAccrue(asset);
        UserPosition position = positionAccounting.lockExisting(userId, asset, LedgerErrorCode.NO_COLLATERAL_OR_NO_DEBT);
        positionAccounting.reconcileSupply(position, market);

        if (enabled) {
            if (position.getSuppliedAmount().signum() <= 0) {
                throw new LedgerException(LedgerErrorCode.NO_COLLATERAL_OR_NO_DEBT, "nothing supplied: asset=" + asset);
            }
        } else if (!solvencyEvaluator.remainsSolventWithoutCollateral(userId, asset)) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_COLLATERAL);
        }
        position.setCollateral(enabled);

        log.info("[LendingService] 담보 설정 변경: userId={}, asset={}, enabled={}", userId, asset, enabled);
        eventPublisher.publishEvent(LedgerEvent.builder()
                .eventType(LedgerEventType.COLLATERAL_CHANGED)
                .userId(userId)
                .asset(asset)
                .flag(enabled)
                .timestamp(LocalDateTime.now(clock))
                .build());
        return position;
    }

    private void requirePositive(BigInteger amount) {
        if (!WadMath.isPositive(amount)) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT);
        }
    }

    private Market requireActive(Market market) {
        if (!Boolean.TRUE.equals(market.getActive())) {
            throw new LedgerException(LedgerErrorCode.ASSET_NOT_ACTIVE, market.getAsset());
        }
        return market;
    }

    private void publish(LedgerEventType type, Long userId, String asset, BigInteger amount) {
        eventPublisher.publishEvent(LedgerEvent.builder()
                .eventType(type)
                .userId(userId)
                .asset(asset)
                .amount(amount)
                .timestamp(LocalDateTime.now(clock))
                .build());
    }
}
