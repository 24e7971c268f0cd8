package dustin.lending.domains.wallet.service;

import java.math.BigInteger;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.domains.wallet.model.entity.WalletBalance;
import dustin.lending.domains.wallet.repository.WalletBalanceRepository;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import dustin.lending.shared.math.WadMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 보관 계정 기반 자산 이체
 * Custody-backed Asset Transfer Gateway
 *
 * 역할:
 * - wallet_balances 테이블 위에서 pull/push 수행
 * - 호출자의 트랜잭션에 참여 (원장 변경과 같은 트랜잭션에서 커밋/롤백)
 *
 * 락 순서:
 * - custody 행(userId = 0)을 먼저, 사용자 행을 나중에 잠금
 * - 같은 자산의 지갑 행은 항상 해당 마켓 락을 보유한 상태에서 접근됨
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustodyAssetTransferGateway implements AssetTransferGateway {

    private final WalletBalanceRepository walletBalanceRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void pull(String asset, Long from, BigInteger amount) {
        if (!WadMath.isPositive(amount)) {
            return;
        }

        WalletBalance custody = lockOrCreate(WalletBalance.CUSTODY_ACCOUNT_ID, asset);
        WalletBalance source = walletBalanceRepository.findByUserIdAndAssetForUpdate(from, asset)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.TRANSFER_FAILED,
                        "no wallet balance: userId=" + from + ", asset=" + asset));

        if (source.getAvailable().compareTo(amount) < 0) {
            throw new LedgerException(LedgerErrorCode.TRANSFER_FAILED,
                    "wallet balance " + source.getAvailable() + " < " + amount);
        }

        source.setAvailable(source.getAvailable().subtract(amount));
        custody.setAvailable(custody.getAvailable().add(amount));

        log.debug("[CustodyAssetTransferGateway] pull: asset={}, from={}, amount={}", asset, from, amount);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void push(String asset, Long to, BigInteger amount) {
        if (!WadMath.isPositive(amount)) {
            return;
        }

        WalletBalance custody = lockOrCreate(WalletBalance.CUSTODY_ACCOUNT_ID, asset);
        if (custody.getAvailable().compareTo(amount) < 0) {
            throw new LedgerException(LedgerErrorCode.TRANSFER_FAILED,
                    "custody liquidity " + custody.getAvailable() + " < " + amount);
        }
        WalletBalance target = lockOrCreate(to, asset);

        custody.setAvailable(custody.getAvailable().subtract(amount));
        target.setAvailable(target.getAvailable().add(amount));

        log.debug("[CustodyAssetTransferGateway] push: asset={}, to={}, amount={}", asset, to, amount);
    }

    private WalletBalance lockOrCreate(Long userId, String asset) {
        return walletBalanceRepository.findByUserIdAndAssetForUpdate(userId, asset)
                .orElseGet(() -> walletBalanceRepository.saveAndFlush(WalletBalance.builder()
                        .userId(userId)
                        .asset(asset)
                        .available(BigInteger.ZERO)
                        .build()));
    }
}
