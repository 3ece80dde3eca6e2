package io.taxlots.domain.trade;

import io.taxlots.domain.common.InvalidRecordException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for trade and lot records.
 */
@DisplayName("Trade Record Tests")
class TradeTest {

    private static final LocalDateTime WHEN = LocalDateTime.of(2019, 3, 4, 9, 30, 12);

    @Test
    void testBuyAndSellFactories() {
        Trade buy = Trade.buy("T1", WHEN, "VOO", 10, new BigDecimal("255.10"));
        Trade sell = Trade.sell("T2", WHEN, "VOO", 4, new BigDecimal("281.50"));

        assertTrue(buy.isBuy());
        assertFalse(buy.isSell());
        assertTrue(sell.isSell());
        assertEquals(LocalDate.of(2019, 3, 4), buy.tradeDate());
        assertEquals(0, new BigDecimal("2551.00").compareTo(buy.value()));
    }

    @Test
    @DisplayName("Forfeit is a zero-price disposal")
    void testForfeitFactory() {
        Trade forfeit = Trade.forfeit("F1", WHEN, "ACME", 5);

        assertTrue(forfeit.isForfeit());
        assertFalse(forfeit.isBuy());
        assertFalse(forfeit.isSell());
        assertEquals(TradeSide.FORFEIT, forfeit.side());
        assertEquals(0, BigDecimal.ZERO.compareTo(forfeit.unitPrice()));
    }

    @Test
    void testForfeitureFragmentsMustCoverForfeit() {
        Trade buy = Trade.buy("T1", WHEN, "ACME", 10, new BigDecimal("30"));
        Trade forfeit = Trade.forfeit("F1", WHEN.plusDays(30), "ACME", 5);
        Trade sale = Trade.sell("S1", WHEN.plusDays(30), "ACME", 5, new BigDecimal("31"));

        assertThrows(IllegalArgumentException.class,
            () -> new Forfeiture(forfeit, List.of(LotFragment.of(buy, 4))));
        assertThrows(IllegalArgumentException.class,
            () -> new Forfeiture(sale, List.of(LotFragment.of(buy, 5))));
        assertThrows(IllegalArgumentException.class,
            () -> new SaleMatch(forfeit, List.of(LotFragment.of(buy, 5))));

        Forfeiture forfeiture = new Forfeiture(forfeit, List.of(LotFragment.of(buy, 5)));
        assertEquals("ACME", forfeiture.symbol());
    }

    @Test
    void testNonPositiveQuantityRejected() {
        assertThrows(InvalidRecordException.class,
            () -> Trade.buy("T1", WHEN, "VOO", 0, new BigDecimal("1")));
        assertThrows(InvalidRecordException.class,
            () -> Trade.sell("T1", WHEN, "VOO", -3, new BigDecimal("1")));
    }

    @Test
    void testNegativePriceRejected() {
        InvalidRecordException e = assertThrows(InvalidRecordException.class,
            () -> Trade.buy("T1", WHEN, "VOO", 1, new BigDecimal("-0.01")));
        assertTrue(e.getMessage().contains("T1"));
        assertNull(e.getSource());
    }

    @Test
    void testZeroPriceAllowed() {
        Trade gift = Trade.buy("T1", WHEN, "VOO", 1, BigDecimal.ZERO);
        assertEquals(0, BigDecimal.ZERO.compareTo(gift.value()));
    }

    @Test
    void testMissingFieldsRejected() {
        assertThrows(InvalidRecordException.class, () -> Trade.buy(" ", WHEN, "VOO", 1, BigDecimal.ONE));
        assertThrows(InvalidRecordException.class, () -> Trade.buy("T1", null, "VOO", 1, BigDecimal.ONE));
        assertThrows(InvalidRecordException.class, () -> Trade.buy("T1", WHEN, "", 1, BigDecimal.ONE));
        assertThrows(InvalidRecordException.class, () -> Trade.buy("T1", WHEN, "VOO", 1, null));
        assertThrows(InvalidRecordException.class,
            () -> new Trade("T1", WHEN, null, "VOO", 1, BigDecimal.ONE));
    }

    @Test
    void testWithQuantityLeavesOriginal() {
        Trade buy = Trade.buy("T1", WHEN, "VOO", 10, new BigDecimal("255.10"));
        Trade reduced = buy.withQuantity(3);

        assertEquals(3, reduced.quantity());
        assertEquals(10, buy.quantity());
        assertEquals(buy.tradeId(), reduced.tradeId());
        assertEquals(buy.unitPrice(), reduced.unitPrice());
    }

    @Test
    void testLotFragmentCarriesBuyTerms() {
        Trade buy = Trade.buy("T1", WHEN, "VOO", 10, new BigDecimal("255.10"));
        LotFragment fragment = LotFragment.of(buy, 4);

        assertEquals("T1", fragment.buyTradeId());
        assertEquals(WHEN, fragment.timestamp());
        assertEquals(LocalDate.of(2019, 3, 4), fragment.buyDate());
        assertEquals(0, new BigDecimal("1020.40").compareTo(fragment.cost()));
    }

    @Test
    void testSaleMatchMustBeFullyFunded() {
        Trade buy = Trade.buy("T1", WHEN, "VOO", 10, new BigDecimal("255.10"));
        Trade sale = Trade.sell("T2", WHEN.plusDays(1), "VOO", 4, new BigDecimal("281.50"));

        assertThrows(IllegalArgumentException.class,
            () -> new SaleMatch(sale, List.of(LotFragment.of(buy, 3))));
        assertThrows(IllegalArgumentException.class,
            () -> new SaleMatch(buy, List.of(LotFragment.of(buy, 10))));

        SaleMatch match = new SaleMatch(sale, List.of(LotFragment.of(buy, 1), LotFragment.of(buy, 3)));
        assertEquals(4, match.amount());
        assertEquals("VOO", match.symbol());
    }

    @Test
    void testMatchResultRemainingQuantity() {
        MatchResult result = new MatchResult(List.of(), List.of(), List.of(
            Trade.buy("T1", WHEN, "VOO", 6, BigDecimal.ONE),
            Trade.buy("T2", WHEN, "VOO", 4, BigDecimal.ONE),
            Trade.buy("T3", WHEN, "SGOL", 2, BigDecimal.ONE)), List.of());

        assertEquals(10, result.remainingQuantity("VOO"));
        assertEquals(2, result.remainingQuantity("SGOL"));
        assertEquals(0, result.remainingQuantity("QQQ"));
    }
}
