package io.barhistory.ingestor;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.barhistory.budget.MemoryBudget;
import io.barhistory.config.HistoryConfig;
import io.barhistory.core.AttachParams;
import io.barhistory.core.History;
import io.barhistory.core.ListDriver;
import io.barhistory.core.TestBars;
import io.barhistory.runtime.HistoryBuilder;
import io.barhistory.runtime.HistoryBuilderFactory;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

public class HistoryModuleTest {
    @Test
    void wires_a_working_builder_factory() throws Exception {
        Injector injector = Guice.createInjector(new HistoryModule(HistoryConfig.defaults().withMemoryBytes(1 << 20)));
        try {
            HistoryBuilderFactory factory = injector.getInstance(HistoryBuilderFactory.class);
            assertSame(factory, injector.getInstance(HistoryBuilderFactory.class));
            assertSame(injector.getInstance(MemoryBudget.class), factory.budget());
            assertEquals(1 << 20, factory.budget().availableBytes());

            HistoryBuilder b = factory.newBuilder();
            b.attachSource(AttachParams.builder(ListDriver.daily(TestBars.weekdays("2024-01-01", 5, 10))).build());
            b.attachSource(AttachParams.builder(ListDriver.daily(TestBars.weekdays("2024-01-03", 5, 20))).build());
            History h = b.build();
            assertEquals(7, h.nbBars());
            assertEquals(1 << 20, factory.budget().availableBytes());
        } finally {
            injector.getInstance(ExecutorService.class).shutdownNow();
        }
    }
}
