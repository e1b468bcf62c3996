package com.oracle.deepsearch.core;

import com.oracle.deepsearch.model.JobData;
import com.oracle.deepsearch.model.QueryConfig;
import com.oracle.deepsearch.model.ResearchSettings;
import com.oracle.deepsearch.model.StepData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.oracle.deepsearch.core.TestCollaborators.answering;
import static com.oracle.deepsearch.core.TestCollaborators.discovering;
import static com.oracle.deepsearch.core.TestCollaborators.results;
import static org.assertj.core.api.Assertions.assertThat;

class StepTest {

    private static final ResearchSettings SETTINGS = ResearchSettings.defaults();

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Step step(List<QueryConfig> queries, Discoverer discoverer, Extractor extractor) {
        return new Step(1, queries, SETTINGS, discoverer, extractor, executor);
    }

    private static List<QueryConfig> queries(String... names) {
        return java.util.Arrays.stream(names).map(name -> QueryConfig.of(name, List.of("g1"))).toList();
    }

    // =========================================================================
    //  initialize()
    // =========================================================================

    @Nested
    @DisplayName("initialize()")
    class Initialize {

        @Test
        @DisplayName("creates one initialized job per query")
        void oneJobPerQuery() {
            Step step = step(queries("q1", "q2", "q3"), discovering("u"), answering("A"));

            assertThat(step.initialize().isSuccess()).isTrue();
            assertThat(step.getState()).isEqualTo(StepState.INITIALIZED);
            assertThat(step.snapshot().getJobs()).hasSize(3);
            assertThat(step.snapshot().getJobs().values())
                    .extracting(JobData::getState)
                    .containsOnly(JobState.INITIALIZED);
        }

        @Test
        @DisplayName("empty batch fails")
        void emptyBatch() {
            Step step = step(List.of(), discovering("u"), answering("A"));

            Outcome<Void> outcome = step.initialize();

            assertThat(outcome.isFailure()).isTrue();
            assertThat(step.getState()).isEqualTo(StepState.FAILED);
            assertThat(step.getErrorMessage()).isEqualTo("No jobs configured for the step");
        }

        @Test
        @DisplayName("one malformed query fails the step and no job ever runs")
        void malformedQuery() {
            AtomicInteger searches = new AtomicInteger();
            Discoverer counting = (query, count) -> {
                searches.incrementAndGet();
                return results("u");
            };
            List<QueryConfig> batch = List.of(QueryConfig.of("q1", List.of("g")), QueryConfig.of("", List.of("g")));
            Step step = step(batch, counting, answering("A"));

            assertThat(step.initialize().isFailure()).isTrue();
            assertThat(step.getState()).isEqualTo(StepState.FAILED);
            assertThat(step.getErrorMessage()).startsWith("Failed to initialize job ").contains("missing query");
            assertThat(step.run().getError().getKind()).isEqualTo(ErrorKind.ILLEGAL_STATE);
            assertThat(searches).hasValue(0);
        }
    }

    // =========================================================================
    //  run()
    // =========================================================================

    @Nested
    @DisplayName("run()")
    class Run {

        @Test
        @DisplayName("partial success completes the step and keeps the failed job's error")
        void partialSuccess() {
            Discoverer secondFails = (query, count) -> {
                if (query.equals("q2")) {
                    throw new CollaboratorException("search backend unavailable");
                }
                return results("https://" + query + ".example");
            };
            Step step = step(queries("q1", "q2", "q3"), secondFails, answering("A"));
            step.initialize();

            Outcome<StepData> outcome = step.run();

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(step.getState()).isEqualTo(StepState.COMPLETED);
            StepData data = outcome.getValue();
            assertThat(data.getJobs()).hasSize(3);
            assertThat(data.completedJobs()).isEqualTo(2);
            assertThat(data.failedJobs()).isEqualTo(1);
            assertThat(data.getJobs().values())
                    .filteredOn(JobData::isFailed)
                    .singleElement()
                    .satisfies(job -> {
                        assertThat(job.getQueryConfig().getQuery()).isEqualTo("q2");
                        assertThat(job.getErrorMessage()).isEqualTo("search backend unavailable");
                    });
            assertThat(data.getFindings()).isEqualTo("q1\n- g1: A\nq3\n- g1: A");
        }

        @Test
        @DisplayName("every job failing fails the step with each job's error")
        void allFail() {
            Step step = step(queries("q1", "q2"), (query, count) -> List.of(), answering("A"));
            step.initialize();

            Outcome<StepData> outcome = step.run();

            assertThat(outcome.getError().getKind()).isEqualTo(ErrorKind.STEP_FAILURE);
            assertThat(step.getState()).isEqualTo(StepState.FAILED);
            assertThat(step.getErrorMessage()).startsWith("All jobs failed: ");
            assertThat(step.getErrorMessage().split("no results found", -1)).hasSize(3);
            assertThat(step.getResults()).isEmpty();
        }

        @Test
        @DisplayName("jobs run concurrently")
        void concurrentJobs() throws InterruptedException {
            CountDownLatch allStarted = new CountDownLatch(3);
            Discoverer rendezvous = (query, count) -> {
                allStarted.countDown();
                try {
                    if (!allStarted.await(5, TimeUnit.SECONDS)) {
                        throw new CollaboratorException("jobs did not overlap");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CollaboratorException("interrupted");
                }
                return results("u");
            };
            Step step = step(queries("q1", "q2", "q3"), rendezvous, answering("A"));
            step.initialize();

            step.run();

            assertThat(allStarted.await(0, TimeUnit.SECONDS)).isTrue();
            assertThat(step.snapshot().completedJobs()).isEqualTo(3);
        }

        @Test
        @DisplayName("findings follow launch order, not completion order")
        void launchOrder() {
            CountDownLatch laterJobsDone = new CountDownLatch(2);
            Discoverer firstIsSlow = (query, count) -> {
                if (query.equals("q1")) {
                    try {
                        laterJobsDone.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                } else {
                    laterJobsDone.countDown();
                }
                return results("u");
            };
            Step step = step(queries("q1", "q2", "q3"), firstIsSlow, answering("A"));
            step.initialize();

            step.run();

            assertThat(step.getFindings()).isEqualTo("q1\n- g1: A\nq2\n- g1: A\nq3\n- g1: A");
            assertThat(step.aggregateFindings()).isEqualTo(step.getFindings());
            assertThat(step.aggregateFindings()).isEqualTo(step.aggregateFindings());
        }

        @Test
        @DisplayName("results are only available after completion")
        void resultsAfterCompletion() {
            Step step = step(queries("q1"), discovering("u"), answering("A"));
            step.initialize();
            assertThat(step.getResults()).isEmpty();

            step.run();

            assertThat(step.getResults()).hasValueSatisfying(data ->
                    assertThat(data.getState()).isEqualTo(StepState.COMPLETED));
        }

        @Test
        @DisplayName("a rejected launch joins the jobs already running and fails the step")
        void rejectedLaunch() {
            AtomicInteger launches = new AtomicInteger();
            Executor closing = task -> {
                if (launches.incrementAndGet() > 1) {
                    throw new RejectedExecutionException("pool is shut down");
                }
                task.run();
            };
            Step step = new Step(1, queries("q1", "q2", "q3"), SETTINGS, discovering("u"), answering("A"), closing);
            step.initialize();

            Outcome<StepData> outcome = step.run();

            assertThat(outcome.getError().getKind()).isEqualTo(ErrorKind.STEP_FAILURE);
            assertThat(step.getState()).isEqualTo(StepState.FAILED);
            assertThat(step.getErrorMessage()).contains("1 of 3 jobs").contains("pool is shut down");
            assertThat(step.snapshot().getJobs().values())
                    .extracting(JobData::getState)
                    .containsExactly(JobState.COMPLETED, JobState.INITIALIZED, JobState.INITIALIZED);
        }

        @Test
        @DisplayName("progress counts finished jobs")
        void progress() {
            Step step = step(queries("q1", "q2"),
                    (query, count) -> query.equals("q1") ? results("u") : List.of(), answering("A"));
            step.initialize();
            step.run();

            assertThat(step.getProgress())
                    .containsEntry("total", 2)
                    .containsEntry("completed", 1L)
                    .containsEntry("failed", 1L)
                    .containsEntry("running", 0L)
                    .containsEntry("progressPercentage", 100.0);
        }
    }
}
