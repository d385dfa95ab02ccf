package com.acme.werp.normalize;

import com.acme.werp.model.Enums.FactorRole;

import java.util.List;
import java.util.Map;

/** Canonical parameter sets per section and schema version. */
public final class CanonicalSchemas {
    private CanonicalSchemas() {}

    public static final String AGE = "Age";

    public static final List<CanonicalSlot> HULL = List.of(
            CanonicalSlot.of(AGE, "\\bage\\b", "\\byears?\\b", "\\blaunched\\b", "\\bbuilt\\b", "\\bcommissioned\\b"),
            CanonicalSlot.of("Vessel Type/Size", "\\btype\\b", "\\bsize\\b", "\\btonnage\\b", "\\bclass\\b",
                    "\\bconstruction\\b", "\\bdisplacement\\b", "\\blength\\b"),
            CanonicalSlot.of("Sinking Trauma", "\\bsinking\\b", "\\btrauma\\b", "\\btorpedo", "\\bexplosion",
                    "\\bbomb", "\\bcollision\\b", "\\bscuttl"),
            CanonicalSlot.of("Current Structural Integrity", "\\bintegrity\\b", "\\bstructur", "\\bcorrosion\\b",
                    "\\bcollapse", "\\bcondition\\b", "\\bdegrad")
    );

    private static final CanonicalSlot FUEL = CanonicalSlot.of("Fuel Volume & Type",
            "\\bfuel\\b", "\\boil\\b", "\\bbunker", "\\bdiesel\\b", "\\bresidual oils?\\b", "\\bleak");
    private static final CanonicalSlot ORDNANCE = CanonicalSlot.of("Ordnance",
            "\\bordnance\\b", "\\bmunitions?\\b", "\\bammunition\\b", "\\bdepth charges?\\b", "\\bexplosives?\\b",
            "\\bcargo risk\\b");
    private static final CanonicalSlot VESSEL_INTEGRITY = CanonicalSlot.of("Vessel Integrity",
            "\\bintegrity\\b", "\\bsinking\\b", "\\bstructur");
    private static final CanonicalSlot HAZMAT = CanonicalSlot.of("Hazardous Materials",
            "\\bhazard", "\\bmaterials?\\b", "\\bchemicals?\\b", "\\basbestos\\b", "\\bpcbs?\\b", "\\bcargo\\b");

    public static final List<CanonicalSlot> POLLUTION_V2 = List.of(FUEL, ORDNANCE, VESSEL_INTEGRITY, HAZMAT);
    public static final List<CanonicalSlot> POLLUTION_V3 = List.of(FUEL, ORDNANCE, HAZMAT);

    /** Fixed weights of the v3 pollution section, keyed by canonical name. */
    public static final Map<String, Double> POLLUTION_V3_WEIGHTS = Map.of(
            FUEL.name(), 0.50,
            ORDNANCE.name(), 0.30,
            HAZMAT.name(), 0.20
    );

    public static final List<CanonicalSlot> SENSITIVITY = List.of(
            CanonicalSlot.of("Proximity to Sensitive Ecosystems", "\\bproximity\\b", "\\becosystems?\\b", "\\breefs?\\b",
                    "\\bcoral", "\\bmangrove", "\\bhabitats?\\b"),
            CanonicalSlot.of("Biodiversity Value", "\\bbiodiversity\\b", "\\bspecies\\b", "\\bfauna\\b", "\\bmarine life\\b"),
            CanonicalSlot.of("Protected Areas", "\\bprotected\\b", "\\bmpas?\\b", "\\breserves?\\b", "\\bsanctuar",
                    "\\bparks?\\b"),
            CanonicalSlot.of("Socioeconomic Sensitivity", "\\bsocio", "\\beconom", "\\bfisher", "\\btourism\\b",
                    "\\blivelihoods?\\b", "\\bcommunit")
    );

    public static final List<CanonicalSlot> PRESSURE_ROLE_CAPPED = List.of(
            CanonicalSlot.of("Thermal Stress", FactorRole.THERMAL, "\\bthermal\\b", "\\bwarming\\b", "\\btemperature\\b",
                    "\\bheat"),
            CanonicalSlot.of("Physical Disturbance", FactorRole.PHYSICAL, "\\bphysical\\b", "\\bseismic", "\\bstorms?\\b",
                    "\\bcurrents?\\b"),
            CanonicalSlot.of("Chemical Exposure", FactorRole.CHEMICAL, "\\bchemical", "\\bacidi", "\\boxygen\\b",
                    "\\bph\\b")
    );

    public static final List<CanonicalSlot> PRESSURE_AVERAGED = List.of(
            CanonicalSlot.of("Thermal Stress", "\\bthermal\\b", "\\btemperature\\b", "\\bwarming\\b", "\\bheat"),
            CanonicalSlot.of("Storm Exposure", "\\bstorms?\\b", "\\bcyclones?\\b", "\\bhurricanes?\\b", "\\btyphoons?\\b",
                    "\\bwaves?\\b"),
            CanonicalSlot.of("Seismic Activity", "\\bseismic", "\\bearthquakes?\\b", "\\btecton"),
            CanonicalSlot.of("Anthropogenic Disturbance", "\\banthropogenic\\b", "\\bshipping\\b", "\\bfishing\\b",
                    "\\btrawl", "\\bhuman\\b", "\\bdevelopment\\b")
    );

    public static List<CanonicalSlot> pollution(int schemaVersion) {
        return schemaVersion >= 3 ? POLLUTION_V3 : POLLUTION_V2;
    }

    public static List<CanonicalSlot> pressure(boolean roleCapped) {
        return roleCapped ? PRESSURE_ROLE_CAPPED : PRESSURE_AVERAGED;
    }

    public static List<String> names(List<CanonicalSlot> slots) {
        return slots.stream().map(CanonicalSlot::name).toList();
    }
}
