package dustin.lending.domains.wallet.service;

import java.math.BigInteger;

/**
 * 자산 이체 협력자
 * Asset Transfer Gateway
 *
 * 사용자 지갑과 프로토콜 보관(custody) 사이의 자금 이동.
 * 두 메서드 모두 전부 성공하거나 전부 실패하며, 실패 시 TRANSFER_FAILED 예외를 던집니다.
 */
public interface AssetTransferGateway {

    /**
     * 사용자 지갑 → custody
     *
     * @param asset 자산
     * @param from 출금 사용자 ID
     * @param amount 수량
     */
    void pull(String asset, Long from, BigInteger amount);

    /**
     * custody → 사용자 지갑
     *
     * @param asset 자산
     * @param to 입금 사용자 ID
     * @param amount 수량
     */
    void push(String asset, Long to, BigInteger amount);
}
