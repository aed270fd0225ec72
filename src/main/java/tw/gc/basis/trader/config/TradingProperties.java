package tw.gc.basis.trader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;
import tw.gc.basis.trader.model.PairConfig;
import tw.gc.basis.trader.model.StrategyConfig;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    private Strategy strategy = new Strategy();
    private Execution execution = new Execution();
    private Bridge bridge = new Bridge();
    private Monitor monitor = new Monitor();
    private Backtest backtest = new Backtest();
    private List<Pair> pairs = new ArrayList<>();

    @Data
    public static class Strategy {
        private double accountSize = 200_000;
        private double spotTargetPct = 0.50;
        private double futuresTargetPct = 0.50;
        private double fundingCostAnnual = 0.05;
        private double leverage = 1.0;
        private double contractSize = 5.0;
        private double minMonthlyBasis = 0.005;

        public StrategyConfig toStrategyConfig() {
            return StrategyConfig.builder()
                    .accountSize(accountSize)
                    .spotTargetPct(spotTargetPct)
                    .futuresTargetPct(futuresTargetPct)
                    .fundingCostAnnual(fundingCostAnnual)
                    .leverage(leverage)
                    .contractSize(contractSize)
                    .minMonthlyBasis(minMonthlyBasis)
                    .build();
        }
    }

    @Data
    public static class Execution {
        private boolean enabled = false;
        private boolean autoTrade = false;
        private boolean dryRun = true;
        /** "limit" or "market" */
        private String orderType = "limit";
        private double limitOffsetPct = 0.001;
        private int maxEtfShares = 10_000;
        private int maxFuturesContracts = 50;
        private int orderTimeoutSeconds = 30;
        private long pollIntervalMs = 500;
        private String stateDir = "output/execution";
        private String journalFile = "output/execution/execution_log.jsonl";
    }

    @Data
    public static class Bridge {
        private String url = "http://localhost:8888";
        private int timeoutMs = 3000;
    }

    @Data
    public static class Monitor {
        private boolean enabled = false;
        private long intervalMs = 300_000;
        private int maxWorkers = 4;
        private int historyLimit = 1000;
        private String historyDir = "output/logs";
    }

    @Data
    public static class Backtest {
        private boolean enabled = false;
        /** CSV with date, spot_price, futures_price, futures_expiry; sample data is generated when blank */
        private String dataFile;
        private String outputFile;
        private int maxHoldingDays = 30;
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate sampleStart = LocalDate.of(2024, 1, 1);
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate sampleEnd = LocalDate.of(2024, 12, 31);
        private long sampleSeed = 42L;
        private double sampleBasePrice = 50_000;
    }

    @Data
    public static class Pair {
        private String pairId = "BTC";
        private String spotSymbol = "IBIT";
        private String futuresSymbol = "MBT";
        private double allocation = 1.0;
        private double contractSize = 0.1;
        private boolean enabled = true;

        public PairConfig toPairConfig() {
            return PairConfig.builder()
                    .pairId(pairId.toUpperCase())
                    .spotSymbol(spotSymbol)
                    .futuresSymbol(futuresSymbol)
                    .allocation(allocation)
                    .contractSize(contractSize)
                    .build();
        }
    }

    /**
     * Enabled pairs; falls back to a single BTC pair when none are configured.
     */
    public List<PairConfig> activePairs() {
        List<Pair> source = pairs.isEmpty() ? List.of(new Pair()) : pairs;
        return source.stream()
                .filter(Pair::isEnabled)
                .map(Pair::toPairConfig)
                .toList();
    }
}
