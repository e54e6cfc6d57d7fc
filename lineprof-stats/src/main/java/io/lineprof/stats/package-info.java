/// Single-pass profiling of delimiter-separated line streams.
///
/// ## Pipeline
///
/// ```
/// LineSource -> GroupRouter -> ValueClassifier -> NumberAccumulator / StringAccumulator
///            -> GroupTable / ColumnTable -> ProfileReport
/// ```
///
/// [io.lineprof.stats.LineProfiler] is the entry point. It owns nothing between calls. Every
/// pass builds its own tables and hands back an ordered, pre-formatted
/// [io.lineprof.stats.report.ProfileReport] for a renderer to print.
///
/// ## Data quality counters
///
/// Bad content never aborts a pass. Empty fields, unparseable numbers and lines missing the
/// delimiter are counted instead, and those counters are the main data quality signal in the
/// output.
package io.lineprof.stats;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
