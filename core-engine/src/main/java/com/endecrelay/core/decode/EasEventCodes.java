package com.endecrelay.core.decode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static table of EAS event codes ({@code EEE} header field) and their
 * display names, per 47 CFR 11.31 plus the NWS additions in common use.
 *
 * @since 1.0.0
 */
public final class EasEventCodes {

    /** Name given to event codes that are not in the table. */
    public static final String UNKNOWN = "Unknown";

    private static final Map<String, String> NAMES;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        // National
        m.put("EAN", "Emergency Action Notification");
        m.put("EAT", "Emergency Action Termination");
        m.put("NIC", "National Information Center");
        m.put("NPT", "National Periodic Test");
        m.put("NAT", "National Audible Test");
        m.put("NST", "National Silent Test");
        m.put("RMT", "Required Monthly Test");
        m.put("RWT", "Required Weekly Test");
        // Administrative
        m.put("ADR", "Administrative Message");
        m.put("DMO", "Practice/Demo Warning");
        m.put("NMN", "Network Message Notification");
        m.put("TOE", "911 Telephone Outage Emergency");
        m.put("TXB", "Transmitter Backup On");
        m.put("TXF", "Transmitter Carrier Off");
        m.put("TXO", "Transmitter Carrier On");
        m.put("TXP", "Transmitter Primary On");
        // Civil
        m.put("BHW", "Biological Hazard Warning");
        m.put("BLU", "Blue Alert");
        m.put("BWW", "Boil Water Warning");
        m.put("CAE", "Child Abduction Emergency");
        m.put("CDW", "Civil Danger Warning");
        m.put("CEM", "Civil Emergency Message");
        m.put("CHW", "Chemical Hazard Warning");
        m.put("CWW", "Contaminated Water Warning");
        m.put("DBA", "Dam Watch");
        m.put("DBW", "Dam Break Warning");
        m.put("DEW", "Contagious Disease Warning");
        m.put("EQW", "Earthquake Warning");
        m.put("EVA", "Evacuation Watch");
        m.put("EVI", "Evacuation Immediate");
        m.put("FCW", "Food Contamination Warning");
        m.put("FRW", "Fire Warning");
        m.put("HMW", "Hazardous Materials Warning");
        m.put("IBW", "Iceberg Warning");
        m.put("IFW", "Industrial Fire Warning");
        m.put("LAE", "Local Area Emergency");
        m.put("LEW", "Law Enforcement Warning");
        m.put("LSW", "Land Slide Warning");
        m.put("MEP", "Missing and Endangered Persons");
        m.put("NUW", "Nuclear Power Plant Warning");
        m.put("POS", "Power Outage Statement");
        m.put("RHW", "Radiological Hazard Warning");
        m.put("SPW", "Shelter in Place Warning");
        m.put("VOW", "Volcano Warning");
        // Weather
        m.put("AVA", "Avalanche Watch");
        m.put("AVW", "Avalanche Warning");
        m.put("BZW", "Blizzard Warning");
        m.put("CFA", "Coastal Flood Watch");
        m.put("CFW", "Coastal Flood Warning");
        m.put("DSW", "Dust Storm Warning");
        m.put("EWW", "Extreme Wind Warning");
        m.put("FFA", "Flash Flood Watch");
        m.put("FFS", "Flash Flood Statement");
        m.put("FFW", "Flash Flood Warning");
        m.put("FLA", "Flood Watch");
        m.put("FLS", "Flood Statement");
        m.put("FLW", "Flood Warning");
        m.put("FSW", "Flash Freeze Warning");
        m.put("FZW", "Freeze Warning");
        m.put("HLS", "Hurricane Local Statement");
        m.put("HUA", "Hurricane Watch");
        m.put("HUW", "Hurricane Warning");
        m.put("HWA", "High Wind Watch");
        m.put("HWW", "High Wind Warning");
        m.put("SMW", "Special Marine Warning");
        m.put("SPS", "Special Weather Statement");
        m.put("SQW", "Snow Squall Warning");
        m.put("SSA", "Storm Surge Watch");
        m.put("SSW", "Storm Surge Warning");
        m.put("SVA", "Severe Thunderstorm Watch");
        m.put("SVR", "Severe Thunderstorm Warning");
        m.put("SVS", "Severe Weather Statement");
        m.put("TOA", "Tornado Watch");
        m.put("TOR", "Tornado Warning");
        m.put("TRA", "Tropical Storm Watch");
        m.put("TRW", "Tropical Storm Warning");
        m.put("TSA", "Tsunami Watch");
        m.put("TSW", "Tsunami Warning");
        m.put("WFA", "Wild Fire Watch");
        m.put("WFW", "Wild Fire Warning");
        m.put("WSA", "Winter Storm Watch");
        m.put("WSW", "Winter Storm Warning");
        // Legacy / regional codes still emitted by older ENDEC firmware
        m.put("ECW", "Extreme Cold Warning");
        m.put("EHW", "Extreme Heat Warning");
        m.put("FGW", "Dense Fog Warning");
        m.put("HTW", "Heat Warning");
        m.put("ISW", "Ice Storm Warning");
        m.put("LFW", "Lakeshore Flood Warning");
        m.put("SCW", "Small Craft Warning");
        m.put("WCW", "Wind Chill Warning");
        NAMES = Map.copyOf(m);
    }

    private EasEventCodes() {
        // static table, not instantiable
    }

    /**
     * @param code three-letter event code
     * @return the display name, or {@value #UNKNOWN}
     */
    public static String nameOf(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return NAMES.getOrDefault(code, UNKNOWN);
    }

    public static boolean isKnown(String code) {
        return code != null && NAMES.containsKey(code);
    }

    public static int size() {
        return NAMES.size();
    }
}
