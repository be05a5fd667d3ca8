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
/**
 * Storage node data layer.
 * <p>
 * This package ties the resident disks to the cluster configuration:
 * <ul>
 *   <li>{@link dev.mars.datalayer.storage.DataLayer} - Facade for foreground operations and transitions</li>
 *   <li>{@link dev.mars.datalayer.storage.DiskTable} - Region to disk map with retained snapshots</li>
 *   <li>{@link dev.mars.datalayer.storage.ReconciliationEngine} - Creates and drops disks per configuration</li>
 *   <li>{@link dev.mars.datalayer.storage.MaintenanceScheduler} - Background flush and IO loop</li>
 *   <li>{@link dev.mars.datalayer.storage.DataLayerConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Prepare before cleanup:</b> a region handed to this instance has its disk before the old one can go</li>
 *   <li><b>Reference-held access:</b> no disk is deleted while a caller still uses it</li>
 *   <li><b>Contained failures:</b> a failing disk is logged and skipped, never fatal to the loop</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * baseDir/
 *  └─ {space}-{subspace}-{prefix}-{mask}/
 *      ├─ segment-00000000.log
 *      └─ segment-00000001.log
 * </pre>
 *
 * @see dev.mars.datalayer.storage.DataLayer
 */
package dev.mars.datalayer.storage;
