/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.datalayer.demo;

import dev.mars.datalayer.cluster.Configuration;
import dev.mars.datalayer.cluster.EntityId;
import dev.mars.datalayer.cluster.InstanceId;
import dev.mars.datalayer.cluster.RegionId;
import dev.mars.datalayer.cluster.StaticConfiguration;
import dev.mars.datalayer.disk.DiskSnapshot;
import dev.mars.datalayer.disk.GetResult;
import dev.mars.datalayer.disk.Hasher;
import dev.mars.datalayer.disk.ReturnCode;
import dev.mars.datalayer.storage.DataLayer;
import dev.mars.datalayer.storage.DataLayerConfig;
import dev.mars.datalayer.storage.DiskTable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Demo entry point for the storage node data layer.
 * <p>
 * This walks one instance through two configuration transitions:
 * <ul>
 *   <li>Version 1: the instance owns regions A and B</li>
 *   <li>Writes and reads against both regions</li>
 *   <li>Version 2: region B moves to another instance and its disk is dropped</li>
 *   <li>Reads against B now answer {@code MISSING_DISK}</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link DataLayerConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (base directory only)</li>
 *   <li>System properties: {@code -Ddatalayer.baseDir=/path -Ddatalayer.syncEnabled=true ...}</li>
 *   <li>Environment variables: {@code DATALAYER_BASE_DIR, DATALAYER_SYNC_ENABLED, ...}</li>
 *   <li>Properties file: {@code datalayer.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl datalayer-demo -am
 *
 * # Run with default configuration
 * java -jar datalayer-demo/target/datalayer-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI base directory override
 * java -jar datalayer-demo/target/datalayer-demo-1.0-SNAPSHOT.jar /path/to/data
 * </pre>
 *
 * @see DataLayerConfig
 */
public class DataLayerDemo {

    private static final InstanceId SELF = new InstanceId("127.0.0.1", 2012);
    private static final InstanceId PEER = new InstanceId("127.0.0.2", 2012);

    private static final RegionId REGION_A = new RegionId(1, 0, 1, 0x0000000000000000L);
    private static final RegionId REGION_B = new RegionId(1, 0, 1, 0x8000000000000000L);

    private static final Hasher HASHER = key -> Arrays.hashCode(key) & 0xFFFFFFFFL;

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|          Data Layer Demo              |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        DataLayerConfig config = args.length > 0 && !args[0].isBlank()
                ? DataLayerConfig.builder().baseDir(args[0]).build()
                : DataLayerConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (DataLayer layer = new DataLayer(config)) {
            System.out.println("[OK] Data layer started at: " + config.baseDir().toAbsolutePath());

            // Version 1: both regions live here
            Configuration v1 = configuration(1, SELF, SELF);
            int created = transition(layer, v1);
            System.out.println("[OK] Applied version 1: created " + created + " disks");
            printResident(layer);

            put(layer, REGION_A, "alice", "engineer", 1);
            put(layer, REGION_B, "bob", "designer", 1);
            System.out.println("[OK] Trickle on A: " + layer.trickle(REGION_A));

            System.out.println();
            System.out.println("  Region A contents:");
            Optional<DiskSnapshot> snapshot = layer.makeSnapshot(REGION_A);
            if (snapshot.isPresent()) {
                try (DiskSnapshot snap = snapshot.get()) {
                    for (; snap.valid(); snap.next()) {
                        System.out.printf("    %s = %s (version %d)%n",
                                text(snap.key()), text(snap.value().get(0)), snap.version());
                    }
                }
            }

            // Version 2: region B moves to the peer
            System.out.println();
            Configuration v2 = configuration(2, SELF, PEER);
            transition(layer, v2);
            System.out.println("[OK] Applied version 2: region B handed to " + PEER);
            printResident(layer);

            GetResult fromA = layer.get(REGION_A, bytes("alice"));
            GetResult fromB = layer.get(REGION_B, bytes("bob"));
            System.out.println("[OK] get(A, alice) -> " + fromA.code() +
                    (fromA.isFound() ? " " + text(fromA.value().get(0)) : ""));
            System.out.println("[OK] get(B, bob)   -> " + fromB.code());

            layer.shutdown();
            System.out.println();
            System.out.println("[OK] Maintenance stopped after " + layer.maintenanceCycles() + " cycles");
        }

        System.out.println();
        System.out.println("+---------------------------------------+");
        System.out.println("|          Demo Complete!               |");
        System.out.println("+---------------------------------------+");
    }

    private static Configuration configuration(long version, InstanceId ownerA, InstanceId ownerB) {
        return StaticConfiguration.builder()
                .version(version)
                .region(REGION_A, 2)
                .region(REGION_B, 2)
                .hasher(REGION_A.subspaceId(), HASHER)
                .entity(new EntityId(REGION_A, 0), ownerA)
                .entity(new EntityId(REGION_B, 0), ownerB)
                .build();
    }

    private static int transition(DataLayer layer, Configuration config) {
        int created = layer.prepare(config, SELF);
        layer.reconfigure(config, SELF);
        layer.cleanup(config, SELF);
        return created;
    }

    private static void put(DataLayer layer, RegionId region, String key, String value, long version) {
        ReturnCode rc = layer.put(region, bytes(key), List.of(bytes(value)), version);
        System.out.println("[OK] put(" + key + ") into " + region + " -> " + rc);
    }

    private static void printResident(DataLayer layer) {
        try (DiskTable.Snapshot disks = layer.disks()) {
            System.out.println("  Resident regions: " + disks.regions());
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }
}
