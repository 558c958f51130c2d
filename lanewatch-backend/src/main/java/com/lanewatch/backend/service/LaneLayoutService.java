package com.lanewatch.backend.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.lanewatch.backend.config.TrafficProperties;
import com.lanewatch.backend.model.lane.Lane;
import com.lanewatch.backend.model.xml.LaneLayout;
import com.lanewatch.backend.model.xml.LaneRegion;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loads the lane rectangles from an XML classpath resource at startup.
 * A missing or empty layout stops the application.
 */
@Slf4j
@Service
public class LaneLayoutService {

    private final TrafficProperties properties;
    private List<Lane> lanes = Collections.emptyList();

    public LaneLayoutService(TrafficProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        String resource = properties.getLaneLayout();
        try (InputStream inputStream = new ClassPathResource(resource).getInputStream()) {
            this.lanes = parse(inputStream);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read lane layout '" + resource + "'", e);
        }
        log.info("✅ Lane layout '{}' loaded: {} lanes", resource, lanes.size());
        for (Lane lane : lanes) {
            log.info("   {} #{}: [{}, {}] -> [{}, {}]", lane.getName(), lane.getIndex(),
                    lane.getX1(), lane.getY1(), lane.getX2(), lane.getY2());
        }
    }

    /**
     * Parses a layout document; lanes are numbered from 1 in document order.
     */
    public static List<Lane> parse(InputStream inputStream) throws IOException {
        XmlMapper xmlMapper = new XmlMapper();
        xmlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        LaneLayout layout = xmlMapper.readValue(inputStream, LaneLayout.class);

        if (layout == null || layout.getLanes() == null || layout.getLanes().isEmpty()) {
            throw new IllegalStateException("Lane layout defines no lanes");
        }
        List<Lane> result = new ArrayList<>();
        int index = 1;
        for (LaneRegion region : layout.getLanes()) {
            try {
                result.add(new Lane(index, region.getName(), region.getX1(), region.getY1(),
                        region.getX2(), region.getY2()));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Malformed lane layout: " + e.getMessage(), e);
            }
            index++;
        }
        return Collections.unmodifiableList(result);
    }

    public List<Lane> getLanes() {
        return lanes;
    }
}
