package io.paywire.examples.facilitator;

import io.paywire.x402.scheme.transfer.ChainReader;
import io.paywire.x402.scheme.transfer.TransferReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ChainReader} for one EVM network, backed by a web3j JSON-RPC client.
 * Token movements are decoded from ERC-20 {@code Transfer} logs.
 */
public class EvmJsonRpcChainReader implements ChainReader {
    private static final Logger log = LoggerFactory.getLogger(EvmJsonRpcChainReader.class);

    static final Event TRANSFER = new Event("Transfer", Arrays.asList(
            new TypeReference<Address>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {}));

    static final String TRANSFER_TOPIC = EventEncoder.encode(TRANSFER);

    private final String network;
    private final Web3j web3j;

    public EvmJsonRpcChainReader(String network, URI rpcUrl) {
        this(network, Web3j.build(new HttpService(rpcUrl.toString())));
    }

    public EvmJsonRpcChainReader(String network, Web3j web3j) {
        this.network = Objects.requireNonNull(network);
        this.web3j = Objects.requireNonNull(web3j);
    }

    @Override
    public Optional<TransferReceipt> receipt(String network, String txHash) throws IOException {
        checkNetwork(network);
        EthGetTransactionReceipt reply = checked("eth_getTransactionReceipt",
                web3j.ethGetTransactionReceipt(txHash).send());
        Optional<TransactionReceipt> found = reply.getTransactionReceipt();
        if (found.isEmpty()) {
            return Optional.empty();
        }
        TransactionReceipt r = found.get();
        BigInteger blockNumber = r.getBlockNumber();

        List<TransferReceipt.TokenTransfer> transfers = new ArrayList<>();
        for (Log entry : r.getLogs()) {
            TransferReceipt.TokenTransfer t = transfer(entry);
            if (t != null) {
                transfers.add(t);
            }
        }

        EthBlock block = checked("eth_getBlockByNumber",
                web3j.ethGetBlockByNumber(DefaultBlockParameter.valueOf(blockNumber), false).send());
        long timestamp = block.getBlock() == null ? 0 : block.getBlock().getTimestamp().longValueExact();
        log.debug("x402 receipt {} block {} status {} transfers {}", txHash, blockNumber, r.isStatusOK(),
                transfers.size());
        String hash = r.getTransactionHash() == null ? txHash : r.getTransactionHash();
        return Optional.of(new TransferReceipt(hash, blockNumber.longValueExact(), r.isStatusOK(), timestamp,
                transfers));
    }

    @Override
    public long latestBlock(String network) throws IOException {
        checkNetwork(network);
        EthBlockNumber reply = checked("eth_blockNumber", web3j.ethBlockNumber().send());
        return reply.getBlockNumber().longValueExact();
    }

    /** Releases the underlying HTTP client. */
    public void shutdown() {
        web3j.shutdown();
    }

    /** @return null for logs that are not a well-formed ERC-20 Transfer */
    @SuppressWarnings("rawtypes")
    static TransferReceipt.TokenTransfer transfer(Log entry) {
        List<String> topics = entry.getTopics();
        if (topics == null || topics.size() != 3 || !TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0))) {
            return null;
        }
        if (!isWord(topics.get(1)) || !isWord(topics.get(2))) {
            log.debug("x402 skipping Transfer log with malformed topics in {}", entry.getTransactionHash());
            return null;
        }
        List<Type> data = FunctionReturnDecoder.decode(entry.getData(), TRANSFER.getNonIndexedParameters());
        if (data.isEmpty()) {
            log.debug("x402 skipping Transfer log with no value in {}", entry.getTransactionHash());
            return null;
        }
        Address from = (Address) FunctionReturnDecoder.decodeIndexedValue(topics.get(1),
                new TypeReference<Address>() {});
        Address to = (Address) FunctionReturnDecoder.decodeIndexedValue(topics.get(2),
                new TypeReference<Address>() {});
        BigInteger value = ((Uint256) data.get(0)).getValue();
        return new TransferReceipt.TokenTransfer(entry.getAddress(), from.getValue(), to.getValue(), value);
    }

    private static boolean isWord(String topic) {
        return topic != null && Numeric.cleanHexPrefix(topic).length() == 64;
    }

    private static <T extends Response<?>> T checked(String method, T reply) throws IOException {
        if (reply.hasError()) {
            throw new IOException(method + " RPC error " + reply.getError().getCode() + ": "
                    + reply.getError().getMessage());
        }
        return reply;
    }

    private void checkNetwork(String requested) throws IOException {
        if (!network.equals(requested)) {
            throw new IOException("no RPC endpoint for " + requested + " (serving " + network + ")");
        }
    }
}
