package com.lendingengine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lendingengine.MutableClock;
import com.lendingengine.PoolTestSupport;
import com.lendingengine.TestClockConfig;
import com.lendingengine.api.dto.AmountRequest;
import com.lendingengine.api.dto.FeeRecipientRequest;
import com.lendingengine.api.dto.LiquidationRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end tests of the REST API and its error mapping.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import({TestClockConfig.class, PoolTestSupport.class})
class LendingApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PoolTestSupport support;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        support.reset();
        support.fundBase("lender", 10_000);
        support.fundCollateral("borrower", 1000);
    }

    @Test
    void testDepositAndReadLender() throws Exception {
        postAmount("/api/v1/lenders/lender/deposit", 1000)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.account").value("lender"))
            .andExpect(jsonPath("$.amountSupplied").value(1000));

        mockMvc.perform(get("/api/v1/lenders/lender"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.amountSupplied").value(1000));

        mockMvc.perform(get("/api/v1/pool"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalSupplied").value(1000))
            .andExpect(jsonPath("$.feeRecipient").value("treasury"));
    }

    @Test
    void testZeroAmountRejected() throws Exception {
        postAmount("/api/v1/lenders/lender/deposit", 0)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INVALID_AMOUNT"));
    }

    @Test
    void testMissingAmountRejected() throws Exception {
        mockMvc.perform(post("/api/v1/lenders/lender/deposit")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.amount").value("Amount is required"));
    }

    @Test
    void testOversizedAccountRejected() throws Exception {
        postAmount("/api/v1/lenders/" + "x".repeat(300) + "/deposit", 1000)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("400"))
            .andExpect(jsonPath("$.error").value("Account id longer than 255 characters"));

        mockMvc.perform(get("/api/v1/pool"))
            .andExpect(jsonPath("$.totalSupplied").value(0));
    }

    @Test
    void testWithdrawMoreThanSupplied() throws Exception {
        postAmount("/api/v1/lenders/lender/deposit", 1000);

        postAmount("/api/v1/lenders/lender/withdraw", 1001)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("INSUFFICIENT_BALANCE"));
    }

    @Test
    void testBorrowLifecycle() throws Exception {
        postAmount("/api/v1/lenders/lender/deposit", 1000);
        postAmount("/api/v1/borrowers/borrower/collateral", 1000)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.collateralDeposited").value(1000));

        postAmount("/api/v1/borrowers/borrower/borrow", 801)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("COLLATERAL_LIMIT_EXCEEDED"));

        postAmount("/api/v1/borrowers/borrower/borrow", 800)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.loanState").value("ACTIVE"))
            .andExpect(jsonPath("$.amountBorrowed").value(800));

        mockMvc.perform(get("/api/v1/borrowers/borrower/debt"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.quarter").value("Q1"))
            .andExpect(jsonPath("$.interest").value(36))
            .andExpect(jsonPath("$.totalDebt").value(836))
            .andExpect(jsonPath("$.collateralRatioBps").value(12500));

        postAmount("/api/v1/borrowers/borrower/repay", 900)
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("OVER_REPAYMENT"));
    }

    @Test
    void testUnknownBorrowerHasNoLoan() throws Exception {
        mockMvc.perform(get("/api/v1/borrowers/nobody"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.loanState").value("NO_LOAN"))
            .andExpect(jsonPath("$.amountBorrowed").value(0));

        postAmount("/api/v1/borrowers/nobody/repay", 10)
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("NO_ACTIVE_LOAN"));
    }

    @Test
    void testLiquidationEndpoints() throws Exception {
        postAmount("/api/v1/lenders/lender/deposit", 1000);
        postAmount("/api/v1/borrowers/borrower/collateral", 1000);
        postAmount("/api/v1/borrowers/borrower/borrow", 800);

        mockMvc.perform(get("/api/v1/liquidations/borrower"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.liquidatable").value(false));
        postJson("/api/v1/liquidations/borrower", new LiquidationRequest("lender"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("NOT_LIQUIDATABLE"));

        clock.setDay(370);

        mockMvc.perform(get("/api/v1/liquidations/borrower"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.liquidatable").value(true))
            .andExpect(jsonPath("$.reasons[0]").value("MATURITY_EXCEEDED"));
        mockMvc.perform(get("/api/v1/liquidations"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].borrower").value("borrower"));
        postJson("/api/v1/liquidations/borrower", new LiquidationRequest("lender"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.loanState").value("NO_LOAN"))
            .andExpect(jsonPath("$.collateralDeposited").value(0));

        mockMvc.perform(get("/api/v1/pool/events/lender"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[1].eventType").value("LIQUIDATE"));
    }

    @Test
    void testFailedTransferMapsToBadGateway() throws Exception {
        support.base().setFailing(true);

        postAmount("/api/v1/lenders/lender/deposit", 1000)
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.code").value("TRANSFER_FAILED"));
    }

    @Test
    void testFeeRecipientUpdateRequiresOwner() throws Exception {
        mockMvc.perform(put("/api/v1/pool/fee-recipient")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new FeeRecipientRequest("mallory", "mallory"))))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mockMvc.perform(put("/api/v1/pool/fee-recipient")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new FeeRecipientRequest("pool-owner", "vault"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.feeRecipient").value("vault"));
    }

    private ResultActions postAmount(String path, long amount) throws Exception {
        return postJson(path, new AmountRequest(amount));
    }

    private ResultActions postJson(String path, Object body) throws Exception {
        return mockMvc.perform(post(path)
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(body)));
    }
}
