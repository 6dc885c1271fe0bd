package com.bookati.booking.jooq;

import com.bookati.booking.domain.PackageDefinition;
import com.bookati.booking.domain.ServiceOffering;
import lombok.RequiredArgsConstructor;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Record8;
import org.jooq.Result;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the service catalog. A package and all of its services are fetched in a
 * single statement so the resolved line items reflect one consistent definition.
 */
@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PackageCatalogJooqRepository {

    static final Table<Record> SERVICES = DSL.table(DSL.name("services"));
    static final Field<Long> SERVICE_ID = DSL.field(DSL.name("services", "id"), SQLDataType.BIGINT);
    static final Field<String> SERVICE_TENANT_ID = DSL.field(DSL.name("services", "tenant_id"), SQLDataType.VARCHAR);
    static final Field<String> SERVICE_NAME = DSL.field(DSL.name("services", "name"), SQLDataType.VARCHAR);
    static final Field<BigDecimal> SERVICE_PRICE =
            DSL.field(DSL.name("services", "price"), SQLDataType.DECIMAL(12, 2));
    static final Field<Boolean> SERVICE_ACTIVE = DSL.field(DSL.name("services", "active"), SQLDataType.BOOLEAN);

    static final Table<Record> PACKAGES = DSL.table(DSL.name("service_packages"));
    static final Field<Long> PACKAGE_ID = DSL.field(DSL.name("service_packages", "id"), SQLDataType.BIGINT);
    static final Field<String> PACKAGE_TENANT_ID =
            DSL.field(DSL.name("service_packages", "tenant_id"), SQLDataType.VARCHAR);
    static final Field<String> PACKAGE_NAME = DSL.field(DSL.name("service_packages", "name"), SQLDataType.VARCHAR);
    static final Field<Boolean> PACKAGE_ACTIVE =
            DSL.field(DSL.name("service_packages", "active"), SQLDataType.BOOLEAN);

    static final Table<Record> PACKAGE_SERVICES = DSL.table(DSL.name("package_services"));
    static final Field<Long> PS_PACKAGE_ID =
            DSL.field(DSL.name("package_services", "package_id"), SQLDataType.BIGINT);
    static final Field<Long> PS_SERVICE_ID =
            DSL.field(DSL.name("package_services", "service_id"), SQLDataType.BIGINT);
    static final Field<Integer> PS_QUANTITY =
            DSL.field(DSL.name("package_services", "quantity"), SQLDataType.INTEGER);

    private final DSLContext dsl;

    /**
     * Loads the package with its service entries ordered by service id.
     * Empty when the package does not exist for the tenant.
     */
    public Optional<PackageDefinition> findPackage(String tenantId, Long packageId) {
        Result<Record8<Long, String, Boolean, Long, Integer, String, BigDecimal, Boolean>> rows = dsl.select(
                        PACKAGE_ID,
                        PACKAGE_NAME,
                        PACKAGE_ACTIVE,
                        PS_SERVICE_ID,
                        PS_QUANTITY,
                        SERVICE_NAME,
                        SERVICE_PRICE,
                        SERVICE_ACTIVE)
                .from(PACKAGES)
                .leftJoin(PACKAGE_SERVICES).on(PS_PACKAGE_ID.eq(PACKAGE_ID))
                .leftJoin(SERVICES).on(SERVICE_ID.eq(PS_SERVICE_ID).and(SERVICE_TENANT_ID.eq(PACKAGE_TENANT_ID)))
                .where(PACKAGE_ID.eq(packageId))
                .and(PACKAGE_TENANT_ID.eq(tenantId))
                .orderBy(PS_SERVICE_ID.asc())
                .fetch();

        if (rows.isEmpty()) {
            return Optional.empty();
        }

        var header = rows.get(0);
        List<PackageDefinition.Entry> entries = new ArrayList<>();
        for (var row : rows) {
            if (row.value4() == null) {
                continue; // package without any service rows
            }
            entries.add(new PackageDefinition.Entry(
                    row.value4(),
                    row.value6(),
                    row.value5() != null ? row.value5() : 0,
                    row.value7(),
                    Boolean.TRUE.equals(row.value8())));
        }
        return Optional.of(new PackageDefinition(
                header.value1(), tenantId, header.value2(), Boolean.TRUE.equals(header.value3()), entries));
    }

    public List<ServiceOffering> findServices(String tenantId, Collection<Long> serviceIds) {
        if (serviceIds == null || serviceIds.isEmpty()) {
            return List.of();
        }
        return dsl.select(SERVICE_ID, SERVICE_NAME, SERVICE_PRICE, SERVICE_ACTIVE)
                .from(SERVICES)
                .where(SERVICE_ID.in(serviceIds))
                .and(SERVICE_TENANT_ID.eq(tenantId))
                .orderBy(SERVICE_ID.asc())
                .fetch(row -> new ServiceOffering(
                        row.value1(), row.value2(), row.value3(), Boolean.TRUE.equals(row.value4())));
    }
}
