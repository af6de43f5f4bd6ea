package com.example.channelinsight.service;

import com.example.channelinsight.dto.QuotaStatusResponse;
import com.example.channelinsight.dto.QuotaStatusResponse.LedgerStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class QuotaStatusService {

    private final QuotaLedger metadataLedger;
    private final QuotaLedger generativeLedger;
    private final SingleFlightCoordinator coordinator;

    public QuotaStatusService(@Qualifier("metadataQuotaLedger") QuotaLedger metadataLedger,
                              @Qualifier("generativeQuotaLedger") QuotaLedger generativeLedger,
                              SingleFlightCoordinator coordinator) {
        this.metadataLedger = metadataLedger;
        this.generativeLedger = generativeLedger;
        this.coordinator = coordinator;
    }

    public QuotaStatusResponse status() {
        return new QuotaStatusResponse(describe(metadataLedger), describe(generativeLedger), coordinator.inFlightCount());
    }

    private static LedgerStatus describe(QuotaLedger ledger) {
        long consumed = ledger.consumed();
        return LedgerStatus.of(ledger.name(), ledger.budget(), consumed,
                Math.max(0, ledger.budget() - consumed), ledger.untilReset());
    }
}
