package engine;

import common.consts.RouteErrorTypeEnum;
import model.bo.DistanceIndex;
import model.bo.LocationGraph;
import model.dto.response.RouteError;
import model.dto.response.RouteOutcome;
import model.dto.response.RouteResult;
import model.entity.CargoMission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static engine.RouteFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("贪心路线构建测试")
class RouteBuilderTest {

    private static final double EPS = 1e-6;

    private LocationGraph graph;

    @BeforeEach
    void setUp() {
        graph = stantonGraph();
    }

    @Test
    @DisplayName("三任务场景：全部完成，报酬 55000，载货不超过 168")
    void testThreeMissionScenario() {
        RouteOutcome outcome = new RouteBuilder(graph, 168).build(threeMissionScenario(), PORT_OLISAR);

        assertTrue(outcome.isSuccess());
        RouteResult result = outcome.getResult();
        assertEquals(55_000, result.getTotalPayout(), EPS);
        assertEquals(Arrays.asList("M3", "M2", "M1"), result.getCompletedMissions());
        assertEquals(Arrays.asList(PORT_OLISAR, PORT_OLISAR, LORVILLE, PORT_OLISAR,
                AREA18, AREA18, LORVILLE, LORVILLE), result.getRoute());
        assertEquals(Arrays.asList(
                "Pickup M1 - Medical Supplies",
                "Pickup M3 - Agricultural Supplies",
                "Dropoff M3 at Port Olisar - Agricultural Supplies",
                "Pickup M2 - Titanium",
                "Dropoff M1 at Area18 - Medical Supplies",
                "Dropoff M2 at Lorville - Titanium",
                "Dropoff M1 at Lorville - Medical Supplies"), result.getMissionOrder());

        double[] expectedCargo = {0, 50, 110, 50, 120, 95, 25, 0};
        assertEquals(expectedCargo.length, result.getCargoAtEachStep().size());
        for (int i = 0; i < expectedCargo.length; i++) {
            assertEquals(expectedCargo[i], result.getCargoAtEachStep().get(i), EPS, "第 " + i + " 步载货量");
        }

        double expectedDistance = graph.distance(PORT_OLISAR, LORVILLE) * 2
                + graph.distance(PORT_OLISAR, AREA18)
                + graph.distance(AREA18, LORVILLE);
        assertEquals(expectedDistance, result.getTotalDistance(), 1e-3);
        assertInvariants(result, threeMissionScenario(), 168);
    }

    @Test
    @DisplayName("货物组成随装卸增减，卸空的类型被移除")
    void testCargoComposition() {
        RouteResult result = new RouteBuilder(graph, 168).build(threeMissionScenario(), PORT_OLISAR).getResult();
        List<Map<String, Double>> types = result.getCargoTypesAtSteps();

        assertTrue(types.get(0).isEmpty());
        assertEquals(Map.of("Medical Supplies", 50.0), types.get(1));
        assertEquals(60.0, types.get(2).get("Agricultural Supplies"), EPS);
        assertFalse(types.get(3).containsKey("Agricultural Supplies"), "卸空后类型应移除");
        assertEquals(25.0, types.get(5).get("Medical Supplies"), EPS);
        assertEquals(Arrays.asList("Medical Supplies", "Titanium"), new ArrayList<>(types.get(5).keySet()));
        assertTrue(types.get(types.size() - 1).isEmpty());
    }

    @Test
    @DisplayName("单个任务超过载货量：返回不可行，已完成为空")
    void testInfeasibleMission() {
        CargoMission oversized = mission("BIG", PORT_OLISAR, List.of(AREA18), 200, "Ore", 5000);

        RouteOutcome outcome = new RouteBuilder(graph, 168).build(List.of(oversized), PORT_OLISAR);

        assertFalse(outcome.isSuccess());
        RouteError error = outcome.getError();
        assertEquals(RouteErrorTypeEnum.INFEASIBLE, error.getType());
        assertEquals(List.of(PORT_OLISAR), error.getRouteSoFar());
        assertTrue(error.getCompletedMissions().isEmpty());
        assertEquals(List.of("BIG"), error.getRemainingMissions());
    }

    @Test
    @DisplayName("部分完成后不可行：报告已走路线与剩余任务")
    void testInfeasibleAfterPartialProgress() {
        List<CargoMission> missions = Arrays.asList(
                mission("OK", PORT_OLISAR, List.of(AREA18), 40, "Ore", 1000),
                mission("BIG", LORVILLE, List.of(AREA18), 100, "Ore", 1000));

        RouteError error = new RouteBuilder(graph, 60).build(missions, PORT_OLISAR).getError();

        assertEquals(RouteErrorTypeEnum.INFEASIBLE, error.getType());
        assertEquals(List.of("OK"), error.getCompletedMissions());
        assertEquals(List.of("BIG"), error.getRemainingMissions());
        assertEquals(Arrays.asList(PORT_OLISAR, PORT_OLISAR, AREA18), error.getRouteSoFar());
    }

    @Test
    @DisplayName("未知地点：列出未知名称与全部合法地点")
    void testUnknownLocation() {
        CargoMission ghost = mission("G", "Nonexistent Base", List.of(AREA18), 10, "Ore", 0);

        RouteError error = new RouteBuilder(graph, 168).build(List.of(ghost), PORT_OLISAR).getError();

        assertEquals(RouteErrorTypeEnum.INVALID_LOCATIONS, error.getType());
        assertEquals(List.of("Nonexistent Base"), error.getNames());
        assertEquals(graph.getLocationNames(), error.getValidLocations());
    }

    @Test
    @DisplayName("没有任务时直接失败")
    void testNoMissions() {
        RouteOutcome outcome = new RouteBuilder(graph, 168).build(Collections.emptyList(), PORT_OLISAR);
        assertEquals(RouteErrorTypeEnum.NO_MISSIONS, outcome.getError().getType());
    }

    @Test
    @DisplayName("多卸货点未指定货量时平分：90 SCU 两站各卸 45")
    void testEvenSplitAcrossDropoffs() {
        CargoMission split = mission("S", PORT_OLISAR, Arrays.asList(AREA18, LORVILLE), 90, "Ore", 100);

        RouteResult result = new RouteBuilder(graph, 168).build(List.of(split), PORT_OLISAR).getResult();

        List<Double> cargo = result.getCargoAtEachStep();
        assertEquals(4, cargo.size());
        assertEquals(90.0, cargo.get(1), EPS);
        assertEquals(45.0, cargo.get(1) - cargo.get(2), EPS);
        assertEquals(45.0, cargo.get(2) - cargo.get(3), EPS);
        assertEquals(0.0, cargo.get(3), EPS);
    }

    @Test
    @DisplayName("同地先卸货再装货")
    void testLocalDropoffBeforePickup() {
        List<CargoMission> missions = Arrays.asList(
                mission("A", PORT_OLISAR, List.of(AREA18), 60, "Ore", 100),
                mission("B", AREA18, List.of(PORT_OLISAR), 60, "Ore", 100));

        RouteResult result = new RouteBuilder(graph, 100).build(missions, PORT_OLISAR).getResult();

        assertEquals(Arrays.asList(
                "Pickup A - Ore",
                "Dropoff A at Area18 - Ore",
                "Pickup B - Ore",
                "Dropoff B at Port Olisar - Ore"), result.getMissionOrder());
        // 在 Area18 的两个动作不额外计距离
        assertEquals(graph.distance(PORT_OLISAR, AREA18) * 2, result.getTotalDistance(), 1e-3);
    }

    @Test
    @DisplayName("同分时按请求顺序先扫描到的候选胜出")
    void testTieBreakFollowsRequestOrder() {
        double[][] table = {
                {0, 10, 10, 30},
                {10, 0, 15, 20},
                {10, 15, 0, 20},
                {30, 20, 20, 0}
        };
        LocationGraph symmetric = new LocationGraph(DistanceIndex.fromTable(Arrays.asList("S", "X", "Y", "D"), table));
        CargoMission fromX = mission("mX", "X", List.of("D"), 10, "Ore", 100);
        CargoMission fromY = mission("mY", "Y", List.of("D"), 10, "Ore", 100);

        RouteBuilder builder = new RouteBuilder(symmetric, 100);
        assertEquals("Pickup mX - Ore",
                builder.build(Arrays.asList(fromX, fromY), "S").getResult().getMissionOrder().get(0));
        assertEquals("Pickup mY - Ore",
                builder.build(Arrays.asList(fromY, fromX), "S").getResult().getMissionOrder().get(0));
    }

    @Test
    @DisplayName("相同输入多次规划结果完全一致")
    void testDeterminism() {
        RouteBuilder builder = new RouteBuilder(graph, 168);
        RouteResult first = builder.build(threeMissionScenario(), PORT_OLISAR).getResult();
        RouteResult second = builder.build(threeMissionScenario(), PORT_OLISAR).getResult();
        assertEquals(first, second);
    }

    @Test
    @DisplayName("超过最大步数时返回结构化失败")
    void testStepLimit() {
        RouteOutcome outcome = new RouteBuilder(graph, 168, 2).build(threeMissionScenario(), PORT_OLISAR);

        RouteError error = outcome.getError();
        assertEquals(RouteErrorTypeEnum.STEP_LIMIT_EXCEEDED, error.getType());
        assertEquals(3, error.getRouteSoFar().size());
        assertEquals(Arrays.asList("M2", "M1", "M3"), error.getRemainingMissions());
    }

    @Test
    @DisplayName("随机任务集：载货区间、先装后卸、卸空与报酬核算")
    void testInvariantsOnRandomMissionSets() {
        List<String> names = graph.getLocationNames();
        Random random = new Random(20240601L);

        for (int round = 0; round < 50; round++) {
            List<CargoMission> missions = new ArrayList<>();
            int count = 1 + random.nextInt(6);
            for (int m = 0; m < count; m++) {
                String pickup = names.get(random.nextInt(names.size()));
                List<String> dropoffs = new ArrayList<>();
                int stops = 1 + random.nextInt(3);
                for (int s = 0; s < stops; s++) {
                    dropoffs.add(names.get(random.nextInt(names.size())));
                }
                double scu = 1 + random.nextInt(80);
                missions.add(mission("R" + round + "-" + m, pickup, dropoffs, scu, "T" + random.nextInt(3),
                        random.nextInt(20) * 1000));
            }
            String start = names.get(random.nextInt(names.size()));

            RouteOutcome outcome = new RouteBuilder(graph, 96).build(missions, start);

            assertTrue(outcome.isSuccess(), "每个任务都不超过载货量，应当能完成");
            assertInvariants(outcome.getResult(), missions, 96);
        }
    }

    private void assertInvariants(RouteResult result, List<CargoMission> missions, double capacity) {
        List<Double> cargo = result.getCargoAtEachStep();
        for (double c : cargo) {
            assertTrue(c >= 0 && c <= capacity + EPS, "载货量越界: " + c);
        }
        assertEquals(0.0, cargo.get(cargo.size() - 1), EPS, "完成后应卸空");
        assertEquals(result.getRoute().size(), cargo.size());
        assertEquals(result.getRoute().size(), result.getCargoTypesAtSteps().size());
        assertEquals(result.getRoute().size() - 1, result.getMissionOrder().size());

        Map<String, CargoMission> byId = new HashMap<>();
        for (CargoMission m : missions) {
            byId.put(m.getMissionId(), m);
        }
        double expectedPayout = 0;
        for (String id : result.getCompletedMissions()) {
            expectedPayout += byId.get(id).getPayout();
        }
        assertEquals(expectedPayout, result.getTotalPayout(), EPS);
        assertEquals(missions.size(), result.getCompletedMissions().size());

        List<String> log = result.getMissionOrder();
        for (CargoMission m : missions) {
            int pickupStep = log.indexOf("Pickup " + m.getMissionId() + " - " + m.getCargoType());
            assertTrue(pickupStep >= 0, "缺少装货: " + m.getMissionId());
            assertEquals(m.getPickup(), result.getRoute().get(pickupStep + 1));
            int dropoffsSeen = 0;
            for (int step = 0; step < log.size(); step++) {
                if (log.get(step).startsWith("Dropoff " + m.getMissionId() + " at ")) {
                    assertTrue(step > pickupStep, "卸货早于装货: " + m.getMissionId());
                    assertEquals(m.getDropoff(dropoffsSeen), result.getRoute().get(step + 1));
                    dropoffsSeen++;
                }
            }
            assertEquals(m.getDropoffCount(), dropoffsSeen);
        }
    }
}
