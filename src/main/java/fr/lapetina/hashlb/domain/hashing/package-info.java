/**
 * Consistent hashing tables.
 *
 * <h2>Available Tables</h2>
 * <table border="1">
 *   <tr><th>Type</th><th>Description</th></tr>
 *   <tr><td>{@code ring-hash}</td><td>Ketama ring, entries proportional to weight</td></tr>
 *   <tr><td>{@code maglev}</td><td>Prime-sized lookup table filled from per-host permutations</td></tr>
 * </table>
 *
 * <p>Either can be wrapped in a {@link fr.lapetina.hashlb.domain.hashing.BoundedLoadHashingTable}
 * to cap each host at a multiple of its fair share of active requests.
 *
 * <h2>Custom Tables</h2>
 * <p>Implement {@link fr.lapetina.hashlb.domain.hashing.HashingTableBuilder} and register it
 * with {@link fr.lapetina.hashlb.domain.hashing.HashingTableBuilders}.
 */
package fr.lapetina.hashlb.domain.hashing;
