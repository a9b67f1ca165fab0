package com.tablecast.hub.pos;

import com.tablecast.core.model.MesaRef;
import com.tablecast.core.model.VentaState;
import reactor.core.publisher.Mono;

/**
 * Read access to the third-party POS API.
 */
public interface IPosClient {
    /**
     * Fetches the open sale on a table.
     *
     * @param mesa table to look up
     * @return Mono of the sale, empty when the table has no open sale;
     * errors with {@link PosApiException} on API failure
     */
    Mono<VentaState> fetchVenta(MesaRef mesa);
}
