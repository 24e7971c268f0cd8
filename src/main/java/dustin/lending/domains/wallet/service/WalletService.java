package dustin.lending.domains.wallet.service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.domains.market.repository.MarketRepository;
import dustin.lending.domains.wallet.model.dto.WalletBalanceResponse;
import dustin.lending.domains.wallet.model.entity.WalletBalance;
import dustin.lending.domains.wallet.repository.WalletBalanceRepository;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import dustin.lending.shared.math.WadMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 지갑 서비스
 * Wallet Service
 *
 * 역할:
 * - 지갑 잔고 조회
 * - 테스트넷용 자산 발행 (faucet)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalletService {

    private final WalletBalanceRepository walletBalanceRepository;
    private final MarketRepository marketRepository;

    /**
     * 테스트 자산 발행
     * Mint test asset into a user's wallet
     *
     * @param userId 사용자 ID
     * @param asset 등록된 자산
     * @param amount 발행 수량
     * @return 발행 후 잔고
     */
    @Transactional
    public WalletBalanceResponse mint(Long userId, String asset, BigInteger amount) {
        if (!WadMath.isPositive(amount)) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT);
        }
        if (userId == null || userId <= WalletBalance.CUSTODY_ACCOUNT_ID) {
            throw new LedgerException(LedgerErrorCode.INVALID_USER);
        }
        if (!marketRepository.existsByAsset(asset)) {
            throw new LedgerException(LedgerErrorCode.ASSET_NOT_ACTIVE, asset);
        }

        WalletBalance wallet = walletBalanceRepository.findByUserIdAndAssetForUpdate(userId, asset)
                .orElseGet(() -> WalletBalance.builder()
                        .userId(userId)
                        .asset(asset)
                        .available(BigInteger.ZERO)
                        .build());
        wallet.setAvailable(wallet.getAvailable().add(amount));
        WalletBalance saved = walletBalanceRepository.save(wallet);

        log.info("[WalletService] 자산 발행: userId={}, asset={}, amount={}, balance={}",
                userId, asset, amount, saved.getAvailable());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public BigInteger getAvailable(Long userId, String asset) {
        return walletBalanceRepository.findByUserIdAndAsset(userId, asset)
                .map(WalletBalance::getAvailable)
                .orElse(BigInteger.ZERO);
    }

    @Transactional(readOnly = true)
    public List<WalletBalanceResponse> getBalances(Long userId) {
        List<WalletBalanceResponse> result = new ArrayList<>();
        for (WalletBalance wallet : walletBalanceRepository.findByUserIdOrderByAssetAsc(userId)) {
            result.add(toResponse(wallet));
        }
        return result;
    }

    private WalletBalanceResponse toResponse(WalletBalance wallet) {
        return WalletBalanceResponse.builder()
                .userId(wallet.getUserId())
                .asset(wallet.getAsset())
                .available(wallet.getAvailable())
                .build();
    }
}
