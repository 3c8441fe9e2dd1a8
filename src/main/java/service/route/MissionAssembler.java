package service.route;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.MissionReq;
import model.entity.CargoMission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 请求任务 -> CargoMission
 * 结构错误直接拒绝；数值字段宽松解析，解析失败时按规则回退而不是拒绝整个请求
 */
@Slf4j
@Component
public class MissionAssembler {

    /**
     * @throws BusinessException 任务缺少装货点、货量字段或卸货点，卸货点格式不对，或货量、报酬为负数
     */
    public List<CargoMission> assemble(List<MissionReq> requests) {
        if (requests == null) {
            return Collections.emptyList();
        }
        for (MissionReq req : requests) {
            validateShape(req);
        }

        List<CargoMission> missions = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            missions.add(toMission(requests.get(i), i));
        }
        return missions;
    }

    private void validateShape(MissionReq req) {
        if (req == null || req.getPickup() == null || !req.isCargoScuPresent()) {
            throw new BusinessException(ErrorCodes.MISSING_PICKUP_OR_CARGO);
        }
        if (!req.isDropoffsPresent() && req.getDropoff() == null) {
            throw new BusinessException(ErrorCodes.MISSING_DROPOFFS);
        }
        if (req.isDropoffsPresent()) {
            if (!(req.getDropoffs() instanceof List)) {
                throw new BusinessException(ErrorCodes.DROPOFFS_NOT_LIST);
            }
            List<?> dropoffs = (List<?>) req.getDropoffs();
            if (dropoffs.isEmpty()) {
                throw new BusinessException(ErrorCodes.EMPTY_DROPOFFS);
            }
            for (Object dropoff : dropoffs) {
                if (!(dropoff instanceof String)) {
                    throw new BusinessException(ErrorCodes.DROPOFF_NOT_TEXT);
                }
            }
        }
    }

    private CargoMission toMission(MissionReq req, int position) {
        String missionId = req.getId() != null ? req.getId() : "M" + (position + 1);

        List<Double> amounts = parseAmounts(missionId, req.getDropoffCargoAmounts());

        Double cargoScu = parseNumber(req.getCargoScu());
        if (cargoScu == null) {
            double sum = 0;
            for (Double amount : amounts) {
                sum += amount;
            }
            cargoScu = sum;
            log.warn("任务 {} 的 cargo_scu [{}] 无法解析，使用各卸货点货量之和: {}", missionId, req.getCargoScu(), sum);
        } else if (cargoScu < 0) {
            throw new BusinessException(ErrorCodes.NEGATIVE_CARGO);
        }

        Double payout = 0.0;
        if (req.getPayout() != null) {
            payout = parseNumber(req.getPayout());
            if (payout == null) {
                log.warn("任务 {} 的 payout [{}] 无法解析，按 0 计算", missionId, req.getPayout());
                payout = 0.0;
            } else if (payout < 0) {
                throw new BusinessException(ErrorCodes.NEGATIVE_PAYOUT);
            }
        }

        return CargoMission.of(missionId, req.getPickup(), resolveDropoffs(req), cargoScu,
                req.getCargoType(), req.getDropoffCargoTypes(), amounts, payout, req.getDescription());
    }

    /**
     * 新格式 dropoffs 优先，未提供时使用旧格式的单个 dropoff
     */
    private List<String> resolveDropoffs(MissionReq req) {
        List<String> dropoffs = new ArrayList<>();
        if (req.getDropoffs() instanceof List) {
            for (Object dropoff : (List<?>) req.getDropoffs()) {
                dropoffs.add((String) dropoff);
            }
        }
        if (dropoffs.isEmpty() && req.getDropoff() != null) {
            dropoffs.add(req.getDropoff());
        }
        return dropoffs;
    }

    /**
     * 任意一个数值解析失败则整体丢弃，由 CargoMission 平分总货量
     *
     * @throws BusinessException 存在负数货量
     */
    private List<Double> parseAmounts(String missionId, Object raw) {
        if (raw == null) {
            return Collections.emptyList();
        }
        if (!(raw instanceof List)) {
            log.warn("任务 {} 的 dropoff_cargo_amounts 不是数组，忽略: {}", missionId, raw);
            return Collections.emptyList();
        }
        List<Double> amounts = new ArrayList<>();
        for (Object item : (List<?>) raw) {
            Double value = parseNumber(item);
            if (value == null) {
                log.warn("任务 {} 的卸货量无法转换为数字，忽略: {}", missionId, raw);
                return Collections.emptyList();
            }
            if (value < 0) {
                throw new BusinessException(ErrorCodes.NEGATIVE_DROPOFF_AMOUNT);
            }
            amounts.add(value);
        }
        return amounts;
    }

    /**
     * 数字或数字字符串 -> double，其余返回 null
     */
    static Double parseNumber(Object raw) {
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            try {
                value = Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }
}
