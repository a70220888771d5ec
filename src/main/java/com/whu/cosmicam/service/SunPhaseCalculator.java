package com.whu.cosmicam.service;

import com.whu.cosmicam.model.Coordinates;
import com.whu.cosmicam.model.SunPhase;
import org.shredzone.commons.suncalc.SunPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 太阳相位计算器
 * 纯计算，无副作用：给定时刻和坐标，算出太阳高度角并映射为 SunPhase。
 */
public class SunPhaseCalculator {

    private static final Logger log = LoggerFactory.getLogger(SunPhaseCalculator.class);

    private final ZoneId referenceZone;

    public SunPhaseCalculator(ZoneId referenceZone) {
        this.referenceZone = referenceZone;
    }

    /**
     * 计算失败 (坐标非法、参数为空等) 时按白天处理，保证拍摄不中断
     */
    public SunPhase calculate(Instant instant, Coordinates coordinates) {
        try {
            double altitude = altitude(instant, coordinates);
            SunPhase phase = SunPhase.fromAltitude(altitude);
            log.debug("[太阳相位] 坐标 ({}, {})，高度角 {}° -> {}",
                    coordinates.getLatitude(), coordinates.getLongitude(),
                    String.format("%.3f", altitude), phase.getKey());
            return phase;
        } catch (RuntimeException e) {
            log.error("[太阳相位] 计算失败，按白天处理: {}", e.getMessage(), e);
            return SunPhase.DAY;
        }
    }

    /**
     * 太阳高度角，单位度
     *
     * @throws IllegalArgumentException 坐标超出范围
     */
    public double altitude(Instant instant, Coordinates coordinates) {
        double latitude = coordinates.getLatitude();
        double longitude = coordinates.getLongitude();
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new IllegalArgumentException("纬度超出范围: " + latitude);
        }
        if (!(longitude >= -180.0 && longitude <= 180.0)) {
            throw new IllegalArgumentException("经度超出范围: " + longitude);
        }

        ZonedDateTime time = instant.atZone(referenceZone);
        SunPosition position = SunPosition.compute()
                .on(time)
                .at(latitude, longitude)
                .execute();
        return position.getAltitude();
    }

    public ZoneId getReferenceZone() {
        return referenceZone;
    }
}
