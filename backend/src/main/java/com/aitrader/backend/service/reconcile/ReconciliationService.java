package com.aitrader.backend.service.reconcile;

import com.aitrader.backend.config.ReconcileProperties;
import com.aitrader.backend.exception.NotFoundException;
import com.aitrader.backend.model.ExchangeAccount;
import com.aitrader.backend.model.Execution;
import com.aitrader.backend.model.ExecutionOrderType;
import com.aitrader.backend.model.ExecutionStatus;
import com.aitrader.backend.model.TradePlan;
import com.aitrader.backend.model.TradePlanStatus;
import com.aitrader.backend.repository.ExchangeAccountRepository;
import com.aitrader.backend.repository.ExecutionRepository;
import com.aitrader.backend.repository.TradePlanRepository;
import com.aitrader.backend.service.MetricsService;
import com.aitrader.backend.service.exchange.ExchangeAdapter;
import com.aitrader.backend.service.exchange.ExchangeAdapterFactory;
import com.aitrader.backend.service.exchange.OrderResult;
import com.aitrader.backend.service.lock.DistributedMutex;
import com.aitrader.backend.service.lock.MutexFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Brings live trade plans in line with what the exchange reports. Plan status only ever
 * moves forward, so running twice over the same exchange state changes nothing the second time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReconciliationService {

    static final Set<TradePlanStatus> OPEN_STATUSES = EnumSet.of(
            TradePlanStatus.PENDING,
            TradePlanStatus.ENTRY_PLACED,
            TradePlanStatus.ENTRY_FILLED,
            TradePlanStatus.TP_SL_PLACED);

    private final ExchangeAccountRepository accountRepository;
    private final TradePlanRepository tradePlanRepository;
    private final ExecutionRepository executionRepository;
    private final ExchangeAdapterFactory adapterFactory;
    private final MutexFactory mutexFactory;
    private final MetricsService metricsService;
    private final ReconcileProperties properties;
    private final Clock clock;

    public List<ReconcileReport> reconcileAllAccounts() {
        List<ReconcileReport> reports = new ArrayList<>();
        for (ExchangeAccount account : accountRepository.findByStatus(ExchangeAccount.STATUS_ACTIVE)) {
            try {
                reports.add(reconcile(account.getId()));
            } catch (RuntimeException e) {
                // reconcile has logged and counted it; move on to the next account
                reports.add(ReconcileReport.failed(account.getId()));
            }
        }
        return reports;
    }

    /**
     * Single attempt at the account mutex; a held lock yields a skipped report.
     *
     * @throws NotFoundException if the account does not exist
     */
    public ReconcileReport reconcile(Long accountId) {
        try (DistributedMutex mutex = mutexFactory.reconcile(accountId)) {
            if (!mutex.tryAcquire()) {
                log.info("Reconciliation skipped, lock held elsewhere event=lock_contention account={}", accountId);
                metricsService.recordReconcileRun("skipped");
                return ReconcileReport.skipped(accountId);
            }
            ReconcileReport report = reconcileLocked(accountId);
            metricsService.recordReconcileRun("success");
            log.info("Reconciliation completed account={} checked={} updated={} errors={}",
                    accountId, report.checked(), report.updated(), report.errors());
            return report;
        } catch (RuntimeException e) {
            log.error("Reconciliation failed account={}", accountId, e);
            metricsService.recordReconcileRun("failed");
            throw e;
        }
    }

    private ReconcileReport reconcileLocked(Long accountId) {
        ExchangeAccount account = accountRepository.findById(accountId)
                .orElseThrow(() -> new NotFoundException("Exchange account not found: " + accountId));
        LocalDateTime lookback = LocalDateTime.now(clock).minusHours(properties.getLookbackHours());
        List<TradePlan> plans = tradePlanRepository
                .findByExchangeAccountIdAndPaperFalseAndCreatedAtAfterAndStatusInOrderByCreatedAtAsc(
                        account.getId(), lookback, OPEN_STATUSES, PageRequest.of(0, properties.getBatchSize()));

        int checked = 0;
        int updated = 0;
        int errors = 0;
        try (ExchangeAdapter adapter = adapterFactory.create(account)) {
            for (TradePlan plan : plans) {
                checked++;
                try {
                    if (reconcilePlan(plan, adapter)) {
                        updated++;
                    }
                } catch (RuntimeException e) {
                    errors++;
                    log.error("Error reconciling trade plan {}", plan.getId(), e);
                }
            }
        }
        return new ReconcileReport(accountId, false, checked, updated, errors);
    }

    /**
     * @return true when an execution or the plan itself changed
     */
    boolean reconcilePlan(TradePlan plan, ExchangeAdapter adapter) {
        List<Execution> executions = executionRepository.findByTradePlanIdOrderByCreatedAtAscIdAsc(plan.getId());
        boolean updated = false;
        for (Execution execution : executions) {
            if (execution.getStatus().isTerminal() || execution.getExchangeOrderId() == null) {
                continue;
            }
            try {
                if (refresh(execution, adapter)) {
                    executionRepository.save(execution);
                    updated = true;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to reconcile execution {} order={}: {}",
                        execution.getId(), execution.getExchangeOrderId(), e.getMessage());
            }
        }

        if (advancePlan(plan, executions)) {
            tradePlanRepository.save(plan);
            updated = true;
        }
        return updated;
    }

    private boolean refresh(Execution execution, ExchangeAdapter adapter) {
        Optional<OrderResult> remote = adapter.getOrder(execution.getSymbol(), execution.getExchangeOrderId(),
                execution.getClientOrderId());
        if (remote.isEmpty() || remote.get().status() == null) {
            return false;
        }
        OrderResult order = remote.get();
        Optional<ExecutionStatus> mapped = ExecutionStatus.fromExchangeStatus(order.status().name());
        if (mapped.isEmpty()) {
            return false;
        }

        switch (mapped.get()) {
            case FILLED -> {
                execution.setStatus(ExecutionStatus.FILLED);
                execution.setFilledQuantity(order.filledQty() != null && order.filledQty().signum() > 0
                        ? order.filledQty() : execution.getQuantity());
                if (order.filledPrice() != null) {
                    execution.setPrice(order.filledPrice());
                }
                execution.setFilledAt(LocalDateTime.now(clock));
                metricsService.recordReconcileUpdate("execution_filled");
                log.info("Reconciled execution {} to filled order={}", execution.getId(), execution.getExchangeOrderId());
                return true;
            }
            case CANCELLED -> {
                execution.setStatus(ExecutionStatus.CANCELLED);
                metricsService.recordReconcileUpdate("execution_cancelled");
                log.info("Reconciled execution {} to cancelled order={}", execution.getId(), execution.getExchangeOrderId());
                return true;
            }
            case PARTIALLY_FILLED -> {
                boolean quantityChanged = order.filledQty() != null
                        && (execution.getFilledQuantity() == null
                        || execution.getFilledQuantity().compareTo(order.filledQty()) != 0);
                if (execution.getStatus() == ExecutionStatus.PARTIALLY_FILLED && !quantityChanged) {
                    return false;
                }
                execution.setStatus(ExecutionStatus.PARTIALLY_FILLED);
                if (quantityChanged) {
                    execution.setFilledQuantity(order.filledQty());
                }
                metricsService.recordReconcileUpdate("execution_partial");
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    private boolean advancePlan(TradePlan plan, List<Execution> executions) {
        boolean changed = false;

        List<Execution> entries = ofType(executions, ExecutionOrderType.ENTRY);
        if (!entries.isEmpty() && entries.stream().allMatch(e -> e.getStatus() == ExecutionStatus.FILLED)
                && plan.advanceTo(TradePlanStatus.ENTRY_FILLED)) {
            if (entries.get(0).getPrice() != null) {
                plan.setEntryPrice(entries.get(0).getPrice());
            }
            metricsService.recordReconcileUpdate("plan_entry_filled");
            changed = true;
        }

        List<Execution> protective = new ArrayList<>(ofType(executions, ExecutionOrderType.TP));
        protective.addAll(ofType(executions, ExecutionOrderType.SL));
        if (protective.isEmpty()) {
            return changed;
        }

        if (plan.getStatus() == TradePlanStatus.ENTRY_FILLED && protective.size() == expectedProtectiveOrders(plan)
                && protective.stream().noneMatch(e -> e.getStatus() == ExecutionStatus.FAILED)
                && plan.advanceTo(TradePlanStatus.TP_SL_PLACED)) {
            metricsService.recordReconcileUpdate("plan_tp_sl_placed");
            changed = true;
        }

        if (plan.getStatus() == TradePlanStatus.TP_SL_PLACED
                && protective.stream().allMatch(e -> e.getStatus().isClosed())
                && plan.advanceTo(TradePlanStatus.COMPLETED)) {
            metricsService.recordReconcileUpdate("plan_completed");
            changed = true;
        }
        return changed;
    }

    private static int expectedProtectiveOrders(TradePlan plan) {
        return (plan.getTpPrice() != null ? 1 : 0) + (plan.getSlPrice() != null ? 1 : 0);
    }

    private static List<Execution> ofType(List<Execution> executions, ExecutionOrderType type) {
        return executions.stream()
                .filter(e -> Objects.equals(e.getOrderType(), type))
                .toList();
    }
}
