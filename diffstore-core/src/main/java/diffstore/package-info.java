/**
 * Root API for diffstore: persistent change tracking that skips items whose content did
 * not change since they were last applied, and stages the rest until a scan applies them.
 *
 * <h2>Core Design</h2>
 * <p>Every named collection keeps, per item identity, the
 * {@linkplain diffstore.fingerprint.Fingerprint fingerprint} of the value last applied
 * downstream (<em>committed</em>) and, when a newer value was observed, its fingerprint
 * and encoded payload (<em>pending</em>). {@link diffstore.Differential#add} stages only
 * real changes; {@link diffstore.Differential#each} drains them through a callback in
 * one transaction and promotes each accepted change to committed. Rejected changes stay
 * pending and are retried by the next scan.
 *
 * <p>Optionally, a {@linkplain diffstore.Differential#resetConflictTracking() conflict
 * tracking cycle} rejects a second {@code add} of the same identity, which catches
 * upstream sources that emit duplicate keys.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>diffstore-core</b>: API, apply engine, fingerprinting, SPIs (zero external deps)</li>
 *   <li><b>diffstore-jdbc</b>: JDBC region stores (H2, MySQL, PostgreSQL)</li>
 *   <li><b>diffstore-jackson</b>: Jackson value codec</li>
 *   <li><b>diffstore-micrometer</b>: Micrometer metrics exporter</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (DiffDatabase db = DiffDatabase.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .regionStore(JdbcRegionStores.detect(dataSource))
 *     .build()) {
 *
 *   Differential users = db.open("users");
 *   for (User user : upstream.fetchUsers()) {
 *     users.add(user.id().getBytes(StandardCharsets.UTF_8), user);
 *   }
 *
 *   users.each((id, decoder) -> search.index(decoder.decode(User.class)));
 * }
 * }</pre>
 *
 * @see diffstore.DiffDatabase
 * @see diffstore.Differential
 * @see diffstore.apply.ApplyFunction
 */
package diffstore;
