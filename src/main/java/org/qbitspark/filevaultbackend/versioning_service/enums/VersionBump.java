package org.qbitspark.filevaultbackend.versioning_service.enums;

import java.math.BigDecimal;
import java.math.RoundingMode;

public enum VersionBump {

    MAJOR {
        @Override
        public BigDecimal apply(BigDecimal current) {
            return current.setScale(0, RoundingMode.FLOOR).add(BigDecimal.ONE).setScale(SCALE, RoundingMode.HALF_UP);
        }
    },
    MINOR {
        @Override
        public BigDecimal apply(BigDecimal current) {
            return current.add(new BigDecimal("0.1")).setScale(SCALE, RoundingMode.HALF_UP);
        }
    },
    PATCH {
        @Override
        public BigDecimal apply(BigDecimal current) {
            return current.add(new BigDecimal("0.01")).setScale(SCALE, RoundingMode.HALF_UP);
        }
    };

    public static final int SCALE = 2;
    public static final BigDecimal INITIAL = new BigDecimal("1.00");

    public abstract BigDecimal apply(BigDecimal current);

    public static BigDecimal normalize(BigDecimal version) {
        return version.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
